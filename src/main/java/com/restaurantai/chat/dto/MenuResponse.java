package com.restaurantai.chat.dto;

import com.restaurantai.chat.model.MenuItem;

import java.util.List;

public record MenuResponse(
        boolean success,
        TenantInfoDto restaurant,
        List<MenuItem> items,
        int count
) {
}
