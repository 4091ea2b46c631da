/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.eddy.common.config;

import java.io.IOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.eddy.common.exceptions.UserException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

/**
 * Engine configuration, layered on Typesafe Config. Resolution order,
 * later layers take precedence:
 * <ol>
 * <li><tt>eddy-default.conf</tt>, shipped in this module.</li>
 * <li>Each <tt>eddy-module.conf</tt> found on the class path, in class
 * path order. Modules use these to add defaults for their own keys.</li>
 * <li><tt>eddy-override.conf</tt>, if the application provides one.</li>
 * <li>System properties, which allows <tt>-Deddy.exec...=value</tt>
 * on the command line.</li>
 * </ol>
 * The result is resolved so that <tt>${foo.bar}</tt> substitutions in
 * the files work. Substitutions are not allowed in system properties.
 */
public class EddyConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(EddyConfig.class);

  public static final String DEFAULTS_FILE_NAME = "eddy-default.conf";
  public static final String MODULE_FILE_NAME = "eddy-module.conf";
  public static final String OVERRIDE_FILE_NAME = "eddy-override.conf";

  public static final String EDDY_PARENT = "eddy";
  public static final String EXEC_PARENT = append(EDDY_PARENT, "exec");
  public static final String MEMORY_PARENT = append(EDDY_PARENT, "memory");

  private final Config config;

  private EddyConfig(Config config) {
    this.config = config;
  }

  public static String append(String parent, String key) {
    return parent + "." + key;
  }

  /**
   * Loads the configuration from the class path and system properties.
   */
  public static EddyConfig create() {
    return create(null);
  }

  /**
   * Loads the configuration, with the given properties taking precedence
   * over everything else. Used by tests to adjust individual settings.
   */
  public static EddyConfig create(Properties overrides) {
    ClassLoader loader = EddyConfig.class.getClassLoader();

    // 1. Defaults.

    Config config = ConfigFactory.parseResources(loader, DEFAULTS_FILE_NAME);

    // 2. Module configurations.

    try {
      Enumeration<URL> urls = loader.getResources(MODULE_FILE_NAME);
      while (urls.hasMoreElements()) {
        URL url = urls.nextElement();
        logger.debug("Loading module configuration {}", url);
        config = ConfigFactory.parseURL(url).withFallback(config);
      }
    } catch (IOException e) {
      throw UserException.internalError(e)
          .message("Failed to scan the class path for %s", MODULE_FILE_NAME)
          .build(logger);
    }

    // 3. Site overrides.

    config = ConfigFactory.parseResources(loader, OVERRIDE_FILE_NAME).withFallback(config);

    // 4. System properties, then explicit overrides.

    config = ConfigFactory.systemProperties().withFallback(config);
    if (overrides != null) {
      config = ConfigFactory.parseProperties(overrides).withFallback(config);
    }
    return new EddyConfig(config.resolve());
  }

  /**
   * Returns a copy of this configuration with one value replaced.
   */
  public EddyConfig withValue(String path, Object value) {
    return new EddyConfig(config.withValue(path, ConfigValueFactory.fromAnyRef(value)));
  }

  public Config getConfig() { return config; }

  public boolean hasPath(String path) { return config.hasPath(path); }

  public String getString(String path) { return config.getString(path); }

  public int getInt(String path) { return config.getInt(path); }

  public long getLong(String path) { return config.getLong(path); }

  public boolean getBoolean(String path) { return config.getBoolean(path); }

  /**
   * Reads a size setting such as <tt>2G</tt> or <tt>512M</tt>.
   */
  public long getBytes(String path) { return config.getBytes(path); }

  public long getMillis(String path) {
    return config.getDuration(path, TimeUnit.MILLISECONDS);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
