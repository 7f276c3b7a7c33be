/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.exceptions.ContainerCorruptedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON catalog of a container: every dataset with its chunk locations and attributes.
 * Written after the chunk blobs of each commit. Integral attribute values read back as {@code Long},
 * matching what {@code TypedIniParser} produces.
 */
public record ContainerCatalog(long generation, Map<String, DatasetEntry> datasets) {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .build();

    public ContainerCatalog {
        datasets = new TreeMap<>(datasets);
    }

    public static ContainerCatalog empty() {
        return new ContainerCatalog(0L, Map.of());
    }

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Catalog cannot be serialized", e);
        }
    }

    public static ContainerCatalog fromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, ContainerCatalog.class);
        } catch (IOException e) {
            throw new ContainerCorruptedException("Catalog cannot be parsed", e);
        }
    }
}
