package io.datashape.core.config;

import io.datashape.core.error.ConfigLoadException;
import io.datashape.core.error.ValidationException;
import io.datashape.core.model.ErrorTree;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/** Creates the exception thrown when a load or update fails validation. */
@FunctionalInterface
public interface ValidationExceptionFactory {

    ValidationException create(String schemaName, ErrorTree errors);

    /** The default: plain {@link ValidationException}. */
    static ValidationExceptionFactory standard() {
        return ValidationException::new;
    }

    /**
     * A factory instantiating {@code type} through its public {@code (String, ErrorTree)}
     * constructor.
     *
     * @throws ConfigLoadException if the constructor is missing or not accessible
     */
    static ValidationExceptionFactory forClass(Class<? extends ValidationException> type) {
        Objects.requireNonNull(type, "type must not be null");
        Constructor<? extends ValidationException> constructor;
        try {
            constructor = type.getConstructor(String.class, ErrorTree.class);
        } catch (NoSuchMethodException e) {
            throw new ConfigLoadException(
                    "Exception class " + type.getName() + " must declare a public (String, ErrorTree) constructor", e);
        }
        return (schemaName, errors) -> {
            try {
                return constructor.newInstance(schemaName, errors);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Constructor of " + type.getName() + " failed", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
            }
        };
    }
}
