package io.intellixity.pgvibe.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Looks up implementations listed in every {@code META-INF/pgvibe.factories} resource on the classpath.
 *
 * <p>Each resource is a Properties file keyed by SPI interface name; values are comma-separated
 * implementation class names with public no-arg constructors:</p>
 * <pre>
 * io.intellixity.pgvibe.jdbc.bind.ParameterBinderProvider=com.acme.MyBinderProvider
 * </pre>
 */
public final class FactoriesLoader {
  public static final String RESOURCE = "META-INF/pgvibe.factories";

  private FactoriesLoader() {}

  /** Instances in classpath order, loaded through the context class loader. */
  public static <T> List<T> load(Class<T> spiType) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = FactoriesLoader.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    // first declaration wins; order follows classpath order
    Set<String> implNames = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(instantiate(implName, spiType, cl));
    return out;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Factory class " + implName + " for " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
