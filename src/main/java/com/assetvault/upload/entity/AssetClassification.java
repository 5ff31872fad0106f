package com.assetvault.upload.entity;

public enum AssetClassification {
    ASSET,
    MARKETING,
    AI_GENERATED
}
