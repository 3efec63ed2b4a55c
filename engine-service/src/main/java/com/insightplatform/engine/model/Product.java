package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Catalog entry, read-only for the engine.
 */
@Data
@NoArgsConstructor
@Table("products")
public class Product {

    @Id
    private Long id;

    private String storeId;
    private String productId;
    private String name;
    private String winery;
}
