package com.relaychat.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    public static long getBytesLength(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }

}
