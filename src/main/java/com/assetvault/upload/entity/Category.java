package com.assetvault.upload.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.util.UUID;

@Entity
@Table(name = "categories")
@Data
public class Category {
    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID tenantId;

    private String name;
    private boolean requiresApproval;

    @Enumerated(EnumType.STRING)
    private AssetClassification assetClassification = AssetClassification.ASSET;
}
