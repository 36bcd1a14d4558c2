/*
 * Copyright 2018 Netflix, Inc.
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

package com.netflix.fieldsan.common.util.tuple;

import java.util.Objects;
import java.util.function.Function;

import com.google.common.base.Preconditions;

/**
 * A container type that holds either a value or an error. It provides a collection of additional methods
 * similar to {@link java.util.Optional}. Neither the value nor the error may be null.
 */
public class Either<T, E> {

    private final T value;
    private final E error;

    private Either(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public T getValue() {
        Preconditions.checkState(hasValue(), "Either holds an error: %s", error);
        return value;
    }

    public E getError() {
        Preconditions.checkState(hasError(), "Either holds a value: %s", value);
        return error;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasError() {
        return !hasValue();
    }

    public <U> Either<U, E> flatMap(Function<T, Either<U, E>> mapper) {
        if (hasError()) {
            return ofError(error);
        }
        return mapper.apply(value);
    }

    /**
     * Returns the value, or throws the exception produced by the mapper from the error.
     */
    public <X extends RuntimeException> T orElseThrow(Function<E, X> errorMapper) {
        if (hasValue()) {
            return value;
        }
        throw errorMapper.apply(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Either<?, ?> either = (Either<?, ?>) o;
        return Objects.equals(value, either.value) && Objects.equals(error, either.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return hasValue()
                ? "Either{value=" + value + '}'
                : "Either{error=" + error + '}';
    }

    public static <T, E> Either<T, E> ofValue(T value) {
        return new Either<>(Preconditions.checkNotNull(value, "null value"), null);
    }

    public static <T, E> Either<T, E> ofError(E error) {
        return new Either<>(null, Preconditions.checkNotNull(error, "null error"));
    }
}
