package com.restaurantai.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "menu_items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MenuItem {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @JsonProperty("restaurant_id")
    @Column(name = "restaurant_id", nullable = false)
    private UUID restaurantId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "category", nullable = false)
    private String category;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ingredients")
    private List<String> ingredients;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "allergens")
    private List<String> allergens;

    @Column(name = "vegetarian")
    private boolean vegetarian;

    @Column(name = "vegan")
    private boolean vegan;

    @JsonProperty("gluten_free")
    @Column(name = "gluten_free")
    private boolean glutenFree;

    // 0..5, enforced by a check constraint in the schema
    @JsonProperty("spice_level")
    @Column(name = "spice_level")
    private int spiceLevel;

    @JsonProperty("prep_time")
    @Column(name = "prep_time")
    private String prepTime;

    @Column(name = "calories")
    private Integer calories;

    @JsonProperty("chef_notes")
    @Column(name = "chef_notes", columnDefinition = "TEXT")
    private String chefNotes;

    @JsonProperty("image_url")
    @Column(name = "image_url")
    private String imageUrl;

    @JsonProperty("display_order")
    @Column(name = "display_order")
    private int displayOrder;

    @Column(name = "active")
    private Boolean active;

    public List<String> ingredientList() {
        return ingredients == null ? List.of() : ingredients;
    }

    public List<String> allergenList() {
        return allergens == null ? List.of() : allergens;
    }

    public int caloriesOrZero() {
        return calories == null ? 0 : calories;
    }

    public BigDecimal priceOrZero() {
        return price == null ? BigDecimal.ZERO : price;
    }
}
