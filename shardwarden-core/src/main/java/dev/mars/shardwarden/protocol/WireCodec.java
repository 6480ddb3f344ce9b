/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.shardwarden.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON text encoding of {@link WireMessage} frames.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class WireCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private WireCodec() {
    }

    public static String encode(WireMessage message) {
        try {
            return objectMapper.writerFor(WireMessage.class).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            // every frame is a plain record tree
            throw new IllegalStateException("Unable to encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes one text frame.
     *
     * @throws JsonProcessingException if the text is not JSON or names an unknown type
     */
    public static WireMessage decode(String text) throws JsonProcessingException {
        return objectMapper.readValue(text, WireMessage.class);
    }

    public static ObjectMapper mapper() {
        return objectMapper;
    }
}
