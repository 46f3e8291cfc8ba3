package com.restaurantai.chat.repository;

import com.restaurantai.chat.model.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RestaurantRepository extends JpaRepository<Restaurant, UUID> {
    /**
     * Finds an active restaurant by its subdomain routing key.
     */
    Optional<Restaurant> findBySubdomainAndActiveTrue(String subdomain);
    /**
     * Finds an active restaurant by its URL slug.
     */
    Optional<Restaurant> findBySlugAndActiveTrue(String slug);
}
