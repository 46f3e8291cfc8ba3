package com.restaurantai.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RestaurantChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantChatApplication.class, args);
    }
}
