package io.committer.host;

import io.committer.CommitterFactory;
import io.committer.UnrecoverableCommitterFactoryException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a {@link CommitterFactory} by class name.
 *
 * <p>The factory class must be public and declare a public constructor taking a single
 * {@code Map<String, String>}. It receives the configuration entries under
 * {@value #FACTORY_CONFIG_PREFIX}, with the prefix removed.
 */
public final class CommitterFactories {
    public static final String FACTORY_CLASS_KEY = "factoryClassName";
    public static final String FACTORY_CONFIG_PREFIX = "factory.";

    private CommitterFactories() {}

    /**
     * Instantiates the factory named by {@value #FACTORY_CLASS_KEY} in {@code properties}.
     *
     * @param properties host configuration
     * @return a new factory
     * @throws UnrecoverableCommitterFactoryException if the key is missing or the class cannot be instantiated
     */
    public static CommitterFactory fromProperties(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        String className = properties.get(FACTORY_CLASS_KEY);
        if (className == null || className.isBlank()) {
            throw new UnrecoverableCommitterFactoryException("Missing required property " + FACTORY_CLASS_KEY);
        }
        return instantiate(className.trim(), factoryConfig(properties));
    }

    public static CommitterFactory instantiate(String className, Map<String, String> config) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return instantiate(className, config, loader != null ? loader : CommitterFactories.class.getClassLoader());
    }

    public static CommitterFactory instantiate(String className, Map<String, String> config, ClassLoader loader) {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(loader, "loader");
        Class<?> type;
        try {
            type = Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnrecoverableCommitterFactoryException("Cannot load committer factory class " + className, e);
        }
        if (!CommitterFactory.class.isAssignableFrom(type)) {
            throw new UnrecoverableCommitterFactoryException(
                    className + " does not implement " + CommitterFactory.class.getName());
        }
        return instantiate(type.asSubclass(CommitterFactory.class), config);
    }

    /**
     * Instantiates {@code type} through its {@code Map<String, String>} constructor.
     *
     * @param type   factory class
     * @param config factory configuration
     * @param <F>    factory type
     * @return a new factory
     * @throws UnrecoverableCommitterFactoryException if the constructor is missing or fails
     */
    public static <F extends CommitterFactory> F instantiate(Class<F> type, Map<String, String> config) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(config, "config");
        Constructor<F> constructor;
        try {
            constructor = type.getConstructor(Map.class);
        } catch (NoSuchMethodException e) {
            throw new UnrecoverableCommitterFactoryException(
                    type.getName() + " must declare a public constructor taking Map<String, String>", e);
        }
        try {
            return constructor.newInstance(Collections.unmodifiableMap(new LinkedHashMap<>(config)));
        } catch (InvocationTargetException e) {
            throw new UnrecoverableCommitterFactoryException(
                    "Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new UnrecoverableCommitterFactoryException("Cannot instantiate " + type.getName(), e);
        }
    }

    /**
     * Returns the entries under {@value #FACTORY_CONFIG_PREFIX} with the prefix removed.
     *
     * @param properties host configuration
     * @return an unmodifiable map
     */
    public static Map<String, String> factoryConfig(Map<String, String> properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, String> config = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(FACTORY_CONFIG_PREFIX) && key.length() > FACTORY_CONFIG_PREFIX.length()) {
                config.put(key.substring(FACTORY_CONFIG_PREFIX.length()), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(config);
    }
}
