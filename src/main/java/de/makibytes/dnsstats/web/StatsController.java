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
package de.makibytes.dnsstats.web;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.dnsstats.engine.StatsConfigView;
import de.makibytes.dnsstats.engine.StatsEngine;
import de.makibytes.dnsstats.model.StatsReport;

@RestController
public class StatsController {
    private static final Logger logger = LoggerFactory.getLogger(StatsController.class);

    private final StatsEngine engine;

    public StatsController(StatsEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/control/stats")
    public ResponseEntity<StatsReport> stats() {
        return engine.getReport()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
    }

    @PostMapping("/control/stats_reset")
    public ResponseEntity<Void> reset() {
        try {
            engine.clear();
            return ResponseEntity.ok().build();
        } catch (IOException ex) {
            logger.error("Failed to reset statistics: {}", ex.getMessage(), ex);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @GetMapping("/control/stats/config")
    public StatsConfigView config() {
        return engine.getConfig();
    }

    @PutMapping("/control/stats/config/update")
    public ResponseEntity<String> updateConfig(@RequestBody StatsConfigView config) {
        if (config == null) {
            return ResponseEntity.unprocessableEntity().body("configuration is required");
        }
        try {
            engine.applyConfig(config);
            return ResponseEntity.ok().build();
        } catch (IllegalArgumentException ex) {
            logger.warn("Rejected statistics configuration: {}", ex.getMessage());
            return ResponseEntity.unprocessableEntity().body(ex.getMessage());
        } catch (IOException ex) {
            logger.error("Failed to apply statistics configuration: {}", ex.getMessage(), ex);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getMessage());
        }
    }
}
