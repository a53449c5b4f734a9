package com.example.dubbing_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String publicBaseUrl = "http://localhost:8080/files/";
    /** Scratch space for per-job temporary files. */
    private String workDir = "./data/work";
    private Local local = new Local();

    public String getPublicBaseUrl() { return publicBaseUrl; }
    public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public static class Local {
        private String baseDir = "./data/objects";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    }
}
