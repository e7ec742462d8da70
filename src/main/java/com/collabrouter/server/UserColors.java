package com.collabrouter.server;

import java.util.List;

/**
 * Stable editor highlight color per participant name.
 */
final class UserColors {

    private static final List<String> PALETTE = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#FFA07A",
        "#98D8C8", "#F7DC6F", "#BB8FCE", "#85C1E2",
        "#F8B739", "#52B788", "#E76F51", "#8E44AD"
    );

    private UserColors() {
    }

    static String colorFor(String name) {
        int hash = 0;
        for (int i = 0; i < name.length(); i++) {
            hash += name.charAt(i);
        }
        return PALETTE.get(Math.floorMod(hash, PALETTE.size()));
    }
}
