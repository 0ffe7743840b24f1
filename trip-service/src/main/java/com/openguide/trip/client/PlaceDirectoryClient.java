package com.openguide.trip.client;

import com.openguide.trip.client.dto.PlaceView;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "place-directory", url = "${trip.directories.place-url:}", path = "/api/v1/places")
public interface PlaceDirectoryClient {

    @GetMapping("/{placeId}")
    PlaceView findPlace(@PathVariable("placeId") Long placeId);
}
