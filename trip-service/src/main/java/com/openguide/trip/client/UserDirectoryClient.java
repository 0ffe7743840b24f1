package com.openguide.trip.client;

import com.openguide.trip.client.dto.UserView;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "user-directory", url = "${trip.directories.user-url:}", path = "/api/v1/users")
public interface UserDirectoryClient {

    @GetMapping("/{userId}")
    UserView findUser(@PathVariable("userId") Long userId);
}
