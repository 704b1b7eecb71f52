package io.rowguard.sql.commons.config;

import com.typesafe.config.Config;

/**
 * Pluggable component instantiated from configuration.
 *
 * <p>The block under {@code prefixKey} names the implementation in its {@code class} key. The
 * class is built with a {@code (Config)} constructor when it has one, otherwise with the no-arg
 * constructor followed by {@link #setConfig(Config)}.
 */
public interface ConfigBasedProvider {

    String CLASS_KEY = "class";
    Class<?>[] constructorParameterTypes = {Config.class};

    static <T extends ConfigBasedProvider> T load(Config config, String prefixKey, T defaultObject) throws Exception {
        if (!config.hasPath(prefixKey)) {
            return defaultObject;
        }
        var innerConfig = config.getConfig(prefixKey);
        if (!innerConfig.hasPath(CLASS_KEY)) {
            defaultObject.setConfig(innerConfig);
            return defaultObject;
        }
        return instantiate(innerConfig);
    }

    static <T extends ConfigBasedProvider> T load(Config config, String prefixKey) throws Exception {
        if (!config.hasPath(prefixKey)) {
            throw new IllegalArgumentException("No config found : " + prefixKey);
        }
        return instantiate(config.getConfig(prefixKey));
    }

    void setConfig(Config config);

    @SuppressWarnings("unchecked")
    private static <T extends ConfigBasedProvider> T instantiate(Config innerConfig) throws Exception {
        var clazz = innerConfig.getString(CLASS_KEY);
        var c = Class.forName(clazz);
        if (!ConfigBasedProvider.class.isAssignableFrom(c)) {
            throw new IllegalArgumentException(clazz + " does not implement " + ConfigBasedProvider.class.getName());
        }
        try {
            var constructorWithConfig = c.getConstructor(constructorParameterTypes);
            return (T) constructorWithConfig.newInstance(innerConfig);
        } catch (NoSuchMethodException e) {
            var object = (T) c.getConstructor().newInstance();
            object.setConfig(innerConfig);
            return object;
        }
    }
}
