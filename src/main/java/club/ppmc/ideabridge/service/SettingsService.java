/**
 * SettingsService.java
 *
 * 该服务是环境配置中心，负责管理工作区、Maven、JDK路径和具名运行配置。
 * 它处理配置的加载和持久化，将配置信息以JSON格式存储在工作区的一个隐藏目录 (.ide) 中。
 * 在首次启动时，它会使用 application.properties 中的值作为默认设置来创建配置文件。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.model.Settings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_DIR = ".ide";
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialWorkspaceRoot;
    private final String initialMavenHome;
    private final Map<String, String> initialJdkPaths;

    public SettingsService(
            @Value("${app.workspace-root}") String initialWorkspaceRoot,
            @Value("${app.maven.home:}") String initialMavenHome,
            @Value("#{${app.jdk.paths:{:}}}") Map<String, String> initialJdkPaths) {
        this.initialWorkspaceRoot = initialWorkspaceRoot;
        this.initialMavenHome = initialMavenHome;
        this.initialJdkPaths = initialJdkPaths;
        this.settingsFilePath =
                Paths.get(initialWorkspaceRoot, SETTINGS_DIR, SETTINGS_FILE_NAME).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public Settings getSettings() {
        Settings settings = this.currentSettings;
        return settings != null ? settings : createDefaultSettings();
    }

    public Path getWorkspaceRoot() {
        return Paths.get(getSettings().getWorkspaceRoot()).toAbsolutePath().normalize();
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置，运行配置 {} 个。",
                    settingsFilePath, currentSettings.getRunConfigurations().size());
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。将使用默认设置。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        Path currentSettingsPath = Paths.get(currentSettings.getWorkspaceRoot(), SETTINGS_DIR, SETTINGS_FILE_NAME)
                .toAbsolutePath()
                .normalize();
        if (Files.notExists(currentSettingsPath.getParent())) {
            Files.createDirectories(currentSettingsPath.getParent());
        }
        try {
            Files.write(currentSettingsPath, objectMapper.writeValueAsBytes(currentSettings));
            LOGGER.info("已成功将设置保存到 {}", currentSettingsPath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", currentSettingsPath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        settings.setWorkspaceRoot(this.initialWorkspaceRoot);
        if (StringUtils.hasText(this.initialMavenHome)) {
            settings.setMavenHome(this.initialMavenHome);
        }
        if (this.initialJdkPaths != null && !this.initialJdkPaths.isEmpty()) {
            settings.setJdkPaths(this.initialJdkPaths);
        }
        return settings;
    }
}
