package org.sqlquote.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlquote.config.SqlQuoteConfiguration.ProfileConfiguration;
import org.sqlquote.dialect.Dialects;
import org.sqlquote.escape.IdentifierQuoting;
import org.sqlquote.options.SqlQuoteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@code sqlquote.yaml} 에서 식별자 정책과 방언 설정을 읽습니다.
 * <p>
 * 반환되는 맵의 값은 검증 및 정규화되어 있습니다 (정책은 enum 이름, 방언은 id).
 * 파일이 없거나 읽을 수 없거나 값이 잘못된 경우 경고만 남기고 기본값을 사용합니다.
 */
public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Path startDirectory;
    private final Function<String, String> env;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> env) {
        this.startDirectory = startDirectory;
        this.env = env;
    }

    /**
     * 우선순위: 인자로 받은 프로파일 > {@code SQLQUOTE_PROFILE} 환경변수 > dev
     *
     * @param profile 사용할 프로파일 (null 가능)
     */
    public Map<String, String> loadConfiguration(String profile) {
        String activeProfile = resolveActiveProfile(profile);

        return findConfigFile()
                .flatMap(this::read)
                .flatMap(config -> selectProfile(config, activeProfile))
                .map(this::toOptions)
                .orElseGet(ConfigurationLoader::defaults);
    }

    private String resolveActiveProfile(String profile) {
        if (profile != null && !profile.isBlank()) {
            return profile;
        }
        String envProfile = env.apply(SqlQuoteOptions.Profile.ENV_VAR);
        return envProfile != null && !envProfile.isBlank() ? envProfile : SqlQuoteOptions.Profile.DEFAULT;
    }

    // 시작 디렉토리부터 상위로 올라가며 찾는다
    private Optional<Path> findConfigFile() {
        for (Path dir = startDirectory; dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(SqlQuoteOptions.Profile.CONFIG_FILE);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<SqlQuoteConfiguration> read(Path configFile) {
        try {
            SqlQuoteConfiguration config = yamlMapper.readValue(configFile.toFile(), SqlQuoteConfiguration.class);
            log.debug("Loaded configuration from {}", configFile);
            return Optional.of(config);
        } catch (IOException e) {
            log.warn("Failed to parse {}: {}", configFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ProfileConfiguration> selectProfile(SqlQuoteConfiguration config, String profile) {
        Optional<ProfileConfiguration> selected = Optional.ofNullable(config.getProfiles())
                .map(profiles -> profiles.get(profile));
        if (selected.isEmpty()) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
        }
        return selected;
    }

    private Map<String, String> toOptions(ProfileConfiguration profile) {
        Map<String, String> options = new HashMap<>(defaults());

        String quoting = profile.getIdentifiers() == null ? null : profile.getIdentifiers().getQuoting();
        if (quoting != null) {
            try {
                options.put(SqlQuoteOptions.Identifiers.QUOTING_KEY, IdentifierQuoting.fromName(quoting).name());
            } catch (IllegalArgumentException e) {
                log.warn("{}. Using {}.", e.getMessage(), SqlQuoteOptions.Identifiers.QUOTING_DEFAULT);
            }
        }

        String dialect = profile.getDialect();
        if (dialect != null && !dialect.isBlank()) {
            try {
                options.put(SqlQuoteOptions.Dialect.KEY, Dialects.forName(dialect).name());
            } catch (IllegalArgumentException e) {
                log.warn("{}. No dialect configured.", e.getMessage());
            }
        }
        return options;
    }

    private static Map<String, String> defaults() {
        return Map.of(SqlQuoteOptions.Identifiers.QUOTING_KEY, SqlQuoteOptions.Identifiers.QUOTING_DEFAULT);
    }
}
