package org.lakeshift.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.lakeshift.exception.ConfigException;
import org.lakeshift.options.LakeshiftOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = LakeshiftOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = LakeshiftOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = LakeshiftOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath(), System.getenv());
    }

    public ConfigurationLoader(Path startDirectory, Map<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = Map.copyOf(environment);
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 프로파일 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     * 값 우선순위: 환경변수 > 프로파일 > 기본값 (CLI 플래그는 호출 측에서 덮어씀)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     */
    public MigrationSettings load(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);
        MigrationSettings.MigrationSettingsBuilder builder = MigrationSettings.builder().profile(activeProfile);

        findAndLoadConfiguration().ifPresent(config -> applyProfile(config, activeProfile, cliProfile != null, builder));
        applyEnvironment(builder);

        return builder.build();
    }

    /**
     * 활성 프로파일을 결정합니다.
     */
    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.get(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 lakeshift.yaml을 찾습니다.
     */
    private Optional<LakeshiftConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    log.debug("Using configuration {}", configFile);
                    return Optional.ofNullable(yamlMapper.readValue(configFile.toFile(), LakeshiftConfiguration.class));
                } catch (IOException e) {
                    throw new ConfigException("Failed to parse " + configFile + ": " + e.getMessage(), e);
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private void applyProfile(LakeshiftConfiguration config, String profile, boolean explicit,
                              MigrationSettings.MigrationSettingsBuilder builder) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            // 명시적으로 요청한 프로파일이 없으면 오류, 기본 프로파일은 없어도 됨
            if (explicit) {
                throw new ConfigException("Profile '" + profile + "' not found in " + CONFIG_FILE_NAME);
            }
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return;
        }

        setIfPresent(profileConfig.getCatalog(), builder::catalog);
        setIfPresent(profileConfig.getSchema(), builder::schema);
        setIfPresent(profileConfig.getSchemaDir(), v -> builder.schemaDir(Path.of(v)));
        setIfPresent(profileConfig.getMigrationsDir(), v -> builder.migrationsDir(Path.of(v)));
        setIfPresent(profileConfig.getStateTable(), builder::stateTable);

        var databricks = profileConfig.getDatabricks();
        if (databricks != null) {
            setIfPresent(databricks.getHost(), builder::databricksHost);
            setIfPresent(databricks.getHttpPath(), builder::databricksHttpPath);
            setIfPresent(databricks.getToken(), builder::databricksToken);
            setIfPresent(databricks.getJdbcUrl(), builder::jdbcUrl);
        }
    }

    private void applyEnvironment(MigrationSettings.MigrationSettingsBuilder builder) {
        setIfPresent(environment.get(LakeshiftOptions.Env.CATALOG), builder::catalog);
        setIfPresent(environment.get(LakeshiftOptions.Env.SCHEMA), builder::schema);
        setIfPresent(environment.get(LakeshiftOptions.Env.SCHEMA_DIR), v -> builder.schemaDir(Path.of(v)));
        setIfPresent(environment.get(LakeshiftOptions.Env.MIGRATIONS_DIR), v -> builder.migrationsDir(Path.of(v)));
        setIfPresent(environment.get(LakeshiftOptions.Env.STATE_TABLE), builder::stateTable);
        setIfPresent(environment.get(LakeshiftOptions.Env.DATABRICKS_HOST), builder::databricksHost);
        setIfPresent(environment.get(LakeshiftOptions.Env.DATABRICKS_HTTP_PATH), builder::databricksHttpPath);
        setIfPresent(environment.get(LakeshiftOptions.Env.DATABRICKS_TOKEN), builder::databricksToken);
        setIfPresent(environment.get(LakeshiftOptions.Env.JDBC_URL), builder::jdbcUrl);
    }

    private static void setIfPresent(String value, Consumer<String> setter) {
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }
}
