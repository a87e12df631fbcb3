package com.vecschema.annotations;

import java.util.function.Supplier;

/** Placeholder for {@link VectorStoreField#defaultFactory()} meaning "no default". Never invoked. */
public final class NoDefault implements Supplier<Object> {

    private NoDefault() {
    }

    @Override
    public Object get() {
        throw new UnsupportedOperationException("NoDefault is a marker");
    }
}
