package com.restaurantai.chat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.Restaurant;
import com.restaurantai.chat.model.TenantRoute;
import com.restaurantai.chat.repository.MenuItemRepository;
import com.restaurantai.chat.repository.RestaurantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cache-aside access to restaurant profiles and menus.
 *
 * Read path: cache hit returns directly; on miss the durable store is queried and a found value is written
 * back with a fixed TTL. Negative results are never cached. Any cache failure degrades to a store read.
 * Concurrent misses for the same key may both write back; the values are identical so last write wins.
 */
@Service
public class RestaurantStore {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantStore.class);

    static final String PROFILE_PREFIX = "restaurant:";
    static final String MENU_PREFIX = "menu:";

    private static final TypeReference<List<MenuItem>> MENU_TYPE = new TypeReference<>() {};

    private final RestaurantRepository restaurantRepository;
    private final MenuItemRepository menuItemRepository;
    private final FastCache fastCache;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RestaurantStore(RestaurantRepository restaurantRepository,
                           MenuItemRepository menuItemRepository,
                           FastCache fastCache,
                           ObjectMapper objectMapper,
                           @Value("${app.cache.ttl-seconds:3600}") long ttlSeconds) {
        this.restaurantRepository = restaurantRepository;
        this.menuItemRepository = menuItemRepository;
        this.fastCache = fastCache;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(Math.max(1, ttlSeconds));
    }

    /**
     * Loads the active restaurant addressed by a routing key.
     *
     * @param route a resolved route
     * @return the restaurant, or empty when no active restaurant matches
     * @throws StoreUnavailableException when the durable store cannot be queried
     */
    public Optional<Restaurant> findRestaurant(TenantRoute route) {
        if (route == null || !route.isResolved()) {
            return Optional.empty();
        }
        String key = profileKey(route);
        Optional<Restaurant> cached = readCached(key, Restaurant.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Restaurant> loaded = queryStore("restaurant " + route.cacheKey(), () -> switch (route.scheme()) {
            case SUBDOMAIN -> restaurantRepository.findBySubdomainAndActiveTrue(route.identifier());
            case SLUG -> restaurantRepository.findBySlugAndActiveTrue(route.identifier());
            case NONE -> Optional.<Restaurant>empty();
        });
        loaded.ifPresent(restaurant -> writeCached(key, restaurant));
        return loaded;
    }

    /**
     * Loads the active menu of a restaurant in display order.
     *
     * @throws StoreUnavailableException when the durable store cannot be queried
     */
    public List<MenuItem> findMenu(UUID restaurantId) {
        String key = menuKey(restaurantId);
        Optional<List<MenuItem>> cached = readCachedMenu(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<MenuItem> items = queryStore("menu " + restaurantId,
                () -> menuItemRepository.findByRestaurantIdAndActiveTrueOrderByDisplayOrderAscCategoryAscNameAsc(restaurantId));
        List<MenuItem> menu = items == null ? List.of() : List.copyOf(items);
        // an empty menu is treated like "not found" and left uncached
        if (!menu.isEmpty()) {
            writeCached(key, menu);
        }
        return menu;
    }

    /**
     * Drops the cached profile entries (under every routing key) and the cached menu of a restaurant.
     *
     * @return {@code false} if the cache could not be reached and entries may still be live until they expire
     */
    public boolean invalidate(UUID restaurantId) {
        List<String> keys = new ArrayList<>();
        keys.add(menuKey(restaurantId));
        queryStore("restaurant " + restaurantId, () -> restaurantRepository.findById(restaurantId))
                .ifPresent(restaurant -> {
                    if (restaurant.getSubdomain() != null) {
                        keys.add(profileKey(TenantRoute.subdomain(restaurant.getSubdomain())));
                    }
                    if (restaurant.getSlug() != null) {
                        keys.add(profileKey(TenantRoute.slug(restaurant.getSlug())));
                    }
                });
        try {
            keys.forEach(fastCache::delete);
            logger.info("Invalidated cache for restaurant {} ({} keys)", restaurantId, keys.size());
            return true;
        } catch (CacheUnavailableException e) {
            logger.warn("Cache invalidation for restaurant {} failed: {}", restaurantId, e.getMessage());
            return false;
        }
    }

    static String profileKey(TenantRoute route) {
        return PROFILE_PREFIX + route.cacheKey();
    }

    static String menuKey(UUID restaurantId) {
        return MENU_PREFIX + restaurantId;
    }

    private <T> Optional<T> readCached(String key, Class<T> type) {
        return readRaw(key).flatMap(raw -> {
            try {
                return Optional.ofNullable(objectMapper.readValue(raw, type));
            } catch (JsonProcessingException e) {
                logger.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    private Optional<List<MenuItem>> readCachedMenu(String key) {
        return readRaw(key).flatMap(raw -> {
            try {
                return Optional.ofNullable(objectMapper.readValue(raw, MENU_TYPE)).map(List::copyOf);
            } catch (JsonProcessingException e) {
                logger.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    private Optional<String> readRaw(String key) {
        try {
            Optional<String> raw = fastCache.get(key);
            logger.debug("Cache {} for {}", raw.isPresent() ? "hit" : "miss", key);
            return raw;
        } catch (CacheUnavailableException e) {
            logger.warn("Cache read failed for {}, falling through to database: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCached(String key, Object value) {
        try {
            fastCache.setWithExpiry(key, objectMapper.writeValueAsString(value), ttl);
            logger.debug("Cached {} for {}s", key, ttl.toSeconds());
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize {} for caching: {}", key, e.getOriginalMessage());
        } catch (CacheUnavailableException e) {
            logger.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private <T> T queryStore(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            logger.error("Database lookup of {} failed", what, e);
            throw new StoreUnavailableException("Database unavailable while loading " + what, e);
        }
    }
}
