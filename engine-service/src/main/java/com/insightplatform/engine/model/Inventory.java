package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("inventory")
public class Inventory {

    @Id
    private Long id;

    private String storeId;
    private String productId;
    private int stockQty;
}
