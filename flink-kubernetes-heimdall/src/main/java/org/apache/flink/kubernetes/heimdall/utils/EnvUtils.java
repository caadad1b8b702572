/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.flink.kubernetes.heimdall.utils;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.GlobalConfiguration;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.lang.management.ManagementFactory;
import java.lang.management.RuntimeMXBean;
import java.util.Optional;

/** Util to get value from environments. */
public class EnvUtils {

    public static final String ENV_KUBERNETES_SERVICE_HOST = "KUBERNETES_SERVICE_HOST";
    public static final String ENV_KUBERNETES_SERVICE_PORT = "KUBERNETES_SERVICE_PORT";
    public static final String ENV_CONF_DIR = "HEIMDALL_CONF_DIR";
    public static final String ENV_WATCH_NAMESPACE = "HEIMDALL_WATCH_NAMESPACE";
    public static final String ENV_LABEL_SELECTOR = "HEIMDALL_LABEL_SELECTOR";

    private static final String UNKNOWN = "<unknown>";
    private static final String SEPARATOR =
            "--------------------------------------------------------------------------------";

    /**
     * Get the value provided by environments.
     *
     * @param key the target key
     * @return the value provided by environments, empty if unset or blank.
     */
    public static Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(StringUtils::isNotBlank);
    }

    /**
     * Logs information about the environment, like implementation version, current user, Java
     * version, and JVM parameters.
     *
     * @param log The logger to log the information to.
     * @param componentName The component name to mention in the log.
     * @param commandLineArgs The arguments accompanying the starting the component.
     */
    public static void logEnvironmentInfo(
            Logger log, String componentName, String[] commandLineArgs) {
        if (log.isInfoEnabled()) {
            String version = EnvUtils.class.getPackage().getImplementationVersion();
            String javaHome = System.getenv("JAVA_HOME");
            String arch = System.getProperty("os.arch");
            long maxHeapMegabytes = getMaxJvmHeapMemory() >>> 20;
            log.info(SEPARATOR);
            log.info(
                    " Starting "
                            + componentName
                            + " (Version: "
                            + (version == null ? UNKNOWN : version)
                            + ")");
            log.info(" OS current user: " + System.getProperty("user.name"));
            log.info(" JVM: " + getJvmVersion());
            log.info(" Arch: " + arch);
            log.info(" Maximum heap size: " + maxHeapMegabytes + " MiBytes");
            log.info(" JAVA_HOME: " + (javaHome == null ? "(not set)" : javaHome));
            String[] options = getJvmStartupOptionsArray();
            if (options.length == 0) {
                log.info(" JVM Options: (none)");
            } else {
                log.info(" JVM Options:");
                for (String s : options) {
                    log.info("    " + s);
                }
            }
            if (commandLineArgs == null || commandLineArgs.length == 0) {
                log.info(" Program Arguments: (none)");
            } else {
                log.info(" Program Arguments:");
                for (String s : commandLineArgs) {
                    log.info("    " + maskSensitiveArgument(s));
                }
            }
            log.info(" Classpath: " + System.getProperty("java.class.path"));
            log.info(SEPARATOR);
        }
    }

    /** Name, vendor and version of the running JVM. */
    @VisibleForTesting
    static String getJvmVersion() {
        RuntimeMXBean bean = ManagementFactory.getRuntimeMXBean();
        return bean.getVmName()
                + " - "
                + bean.getVmVendor()
                + " - "
                + bean.getSpecVersion()
                + '/'
                + bean.getVmVersion();
    }

    @VisibleForTesting
    static String[] getJvmStartupOptionsArray() {
        return ManagementFactory.getRuntimeMXBean().getInputArguments().toArray(new String[0]);
    }

    /** Maximum heap in bytes, the physical memory bound applies when the JVM reports none. */
    @VisibleForTesting
    static long getMaxJvmHeapMemory() {
        long maxMemory = Runtime.getRuntime().maxMemory();
        return maxMemory == Long.MAX_VALUE ? Runtime.getRuntime().totalMemory() : maxMemory;
    }

    @VisibleForTesting
    static String maskSensitiveArgument(String arg) {
        return GlobalConfiguration.isSensitive(arg)
                ? GlobalConfiguration.HIDDEN_CONTENT + " (sensitive information)"
                : arg;
    }
}
