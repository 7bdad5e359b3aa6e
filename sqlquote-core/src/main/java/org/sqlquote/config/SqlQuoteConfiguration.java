package org.sqlquote.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class SqlQuoteConfiguration {

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

        @JsonProperty("identifiers")
        private IdentifierConfiguration identifiers;

        @JsonProperty("dialect")
        private String dialect;
    }

    /**
     * 식별자 출력 관련 설정
     */
    @Data
    public static class IdentifierConfiguration {

        /** ALWAYS 또는 AS_NEEDED */
        @JsonProperty("quoting")
        private String quoting;
    }
}
