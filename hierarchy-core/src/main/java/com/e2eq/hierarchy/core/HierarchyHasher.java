package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.model.HierarchyNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.util.*;

/**
 * Computes a stable hash of a forest from its canonical JSON form. Two builds over the same
 * relations hash equal regardless of the order the edges were inserted in.
 */
public final class HierarchyHasher {
    private HierarchyHasher() {}

    private static final ObjectMapper MAPPER = new ObjectMapper(HierarchyJson.jsonFactory())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String computeHash(List<HierarchyNode> forest) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(forest);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(json));
        } catch (Exception e) {
            throw new RuntimeException("Failed to compute hierarchy hash", e);
        }
    }

    public static String computeHash(HierarchyNode root) {
        return computeHash(List.of(root));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
