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

import org.apache.flink.configuration.GlobalConfiguration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/** Test for {@link EnvUtils}. */
public class EnvUtilsTest {

    @Test
    public void testJvmInformation() {
        assertThat(EnvUtils.getJvmVersion()).contains(System.getProperty("java.vm.name"));
        assertNotNull(EnvUtils.getJvmStartupOptionsArray());
        assertThat(EnvUtils.getMaxJvmHeapMemory()).isPositive();
    }

    @Test
    public void testSensitiveArgumentsAreMasked() {
        assertEquals("--port=8088", EnvUtils.maskSensitiveArgument("--port=8088"));
        assertThat(EnvUtils.maskSensitiveArgument("--oauth.client-secret=abc"))
                .startsWith(GlobalConfiguration.HIDDEN_CONTENT)
                .doesNotContain("abc");
    }
}
