package com.vigil.config;

import lombok.Data;

@Data
public class AppConfig {

    /**
     * Directory for session, progress and event files.
     */
    private String dataDir = "./data";
}
