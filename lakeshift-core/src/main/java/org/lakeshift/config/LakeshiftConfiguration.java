package org.lakeshift.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Shape of {@code lakeshift.yaml}.
 */
@Data
public class LakeshiftConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("catalog")
        private String catalog;

        @JsonProperty("schema")
        private String schema;

        @JsonProperty("schemaDir")
        private String schemaDir;

        @JsonProperty("migrationsDir")
        private String migrationsDir;

        @JsonProperty("stateTable")
        private String stateTable;

        @JsonProperty("databricks")
        private DatabricksConfiguration databricks;
    }

    /**
     * 접속 설정. jdbcUrl 이 있으면 host/httpPath 보다 우선
     */
    @Data
    public static class DatabricksConfiguration {

        @JsonProperty("host")
        private String host;

        @JsonProperty("httpPath")
        private String httpPath;

        @JsonProperty("jdbcUrl")
        private String jdbcUrl;

        @ToString.Exclude
        @JsonProperty("token")
        private String token;
    }
}
