package com.restaurantai.chat.repository;

import com.restaurantai.chat.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, UUID> {
    /**
     * Loads the active menu of a restaurant in presentation order.
     */
    List<MenuItem> findByRestaurantIdAndActiveTrueOrderByDisplayOrderAscCategoryAscNameAsc(UUID restaurantId);
}
