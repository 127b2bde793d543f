/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.common.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUtilTest {

    @Test
    void writesCompactJson() {
        ObjectNode node = JsonUtil.newObject();
        node.put("uuid", "m-1");
        assertThat(JsonUtil.toJson(node)).isEqualTo("{\"uuid\":\"m-1\"}");
    }

    @Test
    void readTreeParsesBytes() throws IOException {
        JsonNode node = JsonUtil.readTree("{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        assertThat(node.get("a").asInt()).isEqualTo(1);
    }

    @Test
    void readTreeRejectsGarbageAndEmptyInput() {
        assertThatThrownBy(() -> JsonUtil.readTree("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> JsonUtil.readTree(new byte[0]))
                .isInstanceOf(IOException.class);
    }
}
