package io.kneo.programmer.service.exceptions;

import lombok.Getter;

@Getter
public class AssetNotFoundException extends RuntimeException {
    private final String assetId;

    public AssetNotFoundException(String assetId) {
        super("Asset not found: " + assetId);
        this.assetId = assetId;
    }
}
