/*
 * Copyright (c) 2026 MakiBytes.
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.dnsstats.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import de.makibytes.dnsstats.engine.StatsEngine;
import de.makibytes.dnsstats.engine.StatsEngineConfig;

@Configuration
public class StatsEngineConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StatsEngineConfiguration.class);

    @Bean(initMethod = "start", destroyMethod = "close")
    public StatsEngine statsEngine(DnsStatsProperties properties) throws IOException {
        StatsEngineConfig config = StatsEngineConfig.fromProperties(properties)
                .configModified(() -> logger.info("Statistics configuration changed"))
                .build();
        return new StatsEngine(config);
    }
}
