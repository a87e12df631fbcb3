package com.vecschema.annotations;

import java.util.UUID;
import java.util.function.Supplier;

/** Default factory producing a fresh random UUID string, typically for key fields. */
public final class RandomUuid implements Supplier<String> {

    @Override
    public String get() {
        return UUID.randomUUID().toString();
    }
}
