package com.williamcallahan.actdb.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Storage storage = new Storage();
    private Fixups fixups = new Fixups();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Fixups getFixups() {
        return fixups;
    }

    public void setFixups(Fixups fixups) {
        this.fixups = fixups;
    }

    public static class Storage {
        private String root = "db";
        private int cacheCapacity = 1024;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public int getCacheCapacity() {
            return cacheCapacity;
        }

        public void setCacheCapacity(int cacheCapacity) {
            if (cacheCapacity <= 0) {
                throw new IllegalArgumentException("app.storage.cache-capacity must be positive");
            }
            this.cacheCapacity = cacheCapacity;
        }
    }

    public static class Fixups {
        private String dir = "data/fixups";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
