/**
 * MavenProjectHelper.java
 *
 * 这是一个帮助类，用于处理与Maven项目相关的常见操作：解析pom.xml中的Java版本、选择JDK、
 * 校验Maven安装、构造并执行Maven命令，以及拼装编译输出的类路径。
 * 它是无状态的组件，被编译宿主、执行宿主和调试启动共同使用。
 */
package club.ppmc.ideabridge.util;

import club.ppmc.ideabridge.exception.EnvironmentConfigurationException;
import club.ppmc.ideabridge.model.Settings;
import club.ppmc.ideabridge.service.SettingsService;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MavenProjectHelper {

    private static final Logger LOGGER = LoggerFactory.getLogger(MavenProjectHelper.class);
    private static final String DEFAULT_JAVA_VERSION = "17";
    private static final boolean IS_WINDOWS = System.getProperty("os.name").toLowerCase().contains("win");

    private final SettingsService settingsService;

    public MavenProjectHelper(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * 从项目的 pom.xml 文件中解析 Java 版本，依次查找 java.version、maven.compiler.source、maven.compiler.release。
     */
    public String getJavaVersionFromPom(File projectDir, Consumer<String> logConsumer) {
        File pomFile = new File(projectDir, "pom.xml");
        if (!pomFile.exists()) {
            report(String.format("信息: 在 %s 中未找到 pom.xml。将默认使用 JDK %s。",
                    projectDir.getAbsolutePath(), DEFAULT_JAVA_VERSION), logConsumer);
            return DEFAULT_JAVA_VERSION;
        }

        MavenXpp3Reader reader = new MavenXpp3Reader();
        try (var fileReader = new FileReader(pomFile, StandardCharsets.UTF_8)) {
            Model model = reader.read(fileReader);
            for (String property : List.of("java.version", "maven.compiler.source", "maven.compiler.release")) {
                String version = model.getProperties().getProperty(property);
                if (StringUtils.hasText(version)) {
                    LOGGER.debug("从 <{}> 属性中检测到 Java 版本 '{}'。", property, version);
                    return normalizeJavaVersion(version.trim());
                }
            }
            report(String.format("信息: 在 pom.xml 中未找到指定的Java版本。将默认使用 JDK %s。", DEFAULT_JAVA_VERSION),
                    logConsumer);
            return DEFAULT_JAVA_VERSION;
        } catch (IOException | XmlPullParserException e) {
            String error = String.format("错误: 解析 %s 中的 pom.xml 失败。将默认使用 JDK %s。",
                    projectDir.getAbsolutePath(), DEFAULT_JAVA_VERSION);
            LOGGER.error(error, e);
            if (logConsumer != null) {
                logConsumer.accept(error);
            }
            return DEFAULT_JAVA_VERSION;
        }
    }

    private void report(String message, Consumer<String> logConsumer) {
        LOGGER.info(message);
        if (logConsumer != null) {
            logConsumer.accept(message);
        }
    }

    static String normalizeJavaVersion(String version) {
        if (version.startsWith("1.")) {
            return version.substring(2);
        }
        return version;
    }

    /**
     * 校验 Maven 主目录，必须包含 bin 和 boot 子目录。
     *
     * @throws EnvironmentConfigurationException Maven 未配置或目录无效时抛出。
     */
    public void validateMavenHome(String mavenHome) {
        if (!StringUtils.hasText(mavenHome)) {
            throw new EnvironmentConfigurationException(
                    "Maven 主目录未配置。请在 .ide/settings.json 或 app.maven.home 中配置 mavenHome。", "maven", null);
        }
        Path mavenHomePath = Paths.get(mavenHome);
        if (!Files.isDirectory(mavenHomePath)
                || !Files.isDirectory(mavenHomePath.resolve("boot"))
                || !Files.isDirectory(mavenHomePath.resolve("bin"))) {
            String message = String.format(
                    "提供的Maven主目录 '%s' 无效或不完整。请确保它指向一个有效的Maven安装目录（应包含bin和boot子目录）。", mavenHome);
            throw new EnvironmentConfigurationException(message, "maven", null);
        }
    }

    /**
     * 构造通过 plexus-classworlds 启动 Maven 的完整命令，不依赖系统 PATH 中的 mvn。
     *
     * @throws EnvironmentConfigurationException Maven 未正确配置时抛出。
     * @throws IOException 无法列出 Maven boot 目录时抛出。
     */
    public List<String> buildMavenCommand(Path projectDir, List<String> goals, Consumer<String> logConsumer)
            throws IOException {
        Settings settings = settingsService.getSettings();
        String mavenHome = settings.getMavenHome();
        validateMavenHome(mavenHome);

        String targetReleaseVersion = getJavaVersionFromPom(projectDir.toFile(), logConsumer);
        String javaExecutable = selectJdkExecutable(settings, targetReleaseVersion, logConsumer);

        Path bootDir = Paths.get(mavenHome, "boot");
        File plexusJar;
        try (var stream = Files.list(bootDir)) {
            plexusJar = stream
                    .map(Path::toFile)
                    .filter(file -> file.getName().startsWith("plexus-classworlds") && file.getName().endsWith(".jar"))
                    .findFirst()
                    .orElseThrow(() -> new EnvironmentConfigurationException(
                            "在 " + bootDir + " 中找不到 plexus-classworlds JAR。请检查Maven主目录配置。", "maven", null));
        }

        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.add("-cp");
        command.add(plexusJar.getAbsolutePath());
        command.add("-Dclassworlds.conf=" + Paths.get(mavenHome, "bin", "m2.conf").toAbsolutePath());
        command.add("-Dmaven.home=" + mavenHome);
        command.add("-Dfile.encoding=UTF-8");
        command.add("-Dmaven.multiModuleProjectDirectory=" + projectDir.toAbsolutePath());
        command.add("org.codehaus.plexus.classworlds.launcher.Launcher");
        command.addAll(goals);
        return command;
    }

    /**
     * 同步执行一次Maven构建，逐行把输出交给 lineConsumer。
     *
     * @return Maven 进程的退出码。
     * @throws IOException 进程无法启动或输出读取失败时抛出。
     */
    public int executeMavenBuild(Path projectDir, List<String> goals, Consumer<String> lineConsumer)
            throws IOException, InterruptedException {
        List<String> command = buildMavenCommand(projectDir, goals, lineConsumer);
        LOGGER.info("在目录 {} 中执行: {}", projectDir, String.join(" ", goals));

        var pb = new ProcessBuilder(command).directory(projectDir.toFile()).redirectErrorStream(true);
        Process process = pb.start();
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            reader.lines().forEach(lineConsumer);
        }
        int exitCode = process.waitFor();
        LOGGER.info("Maven 构建完成，退出码: {}", exitCode);
        return exitCode;
    }

    /**
     * 根据优先级选择要使用的JDK可执行文件：用户为该版本配置的路径 > 当前运行的JDK > 系统PATH中的 java。
     */
    public String selectJdkExecutable(Settings settings, String requiredVersion, Consumer<String> logConsumer) {
        String userDefinedJdkPath = settings.getJdkPaths().get("jdk" + requiredVersion);
        if (StringUtils.hasText(userDefinedJdkPath) && Files.isExecutable(Paths.get(userDefinedJdkPath))) {
            LOGGER.debug("使用用户为 JDK {} 配置的路径: {}", requiredVersion, userDefinedJdkPath);
            return userDefinedJdkPath;
        }

        Path javaHome = Paths.get(System.getProperty("java.home"));
        Path backendJdkExecutable = IS_WINDOWS ? javaHome.resolve("bin/java.exe") : javaHome.resolve("bin/java");
        if (Files.isExecutable(backendJdkExecutable)) {
            LOGGER.debug("未找到用户为 JDK {} 配置的有效路径，使用当前运行的 JDK。", requiredVersion);
            return backendJdkExecutable.toAbsolutePath().toString();
        }

        report("警告: 无法找到任何已配置的或内置的JDK。将回退到使用系统PATH中的'java'命令。", logConsumer);
        return "java";
    }

    /**
     * 拼装 target/classes、target/test-classes 以及 target/dependency 中的jar组成的类路径。
     *
     * @throws IOException 编译输出目录不存在时抛出。
     */
    public String buildClasspath(Path projectDir) throws IOException {
        Path targetDir = projectDir.resolve("target");
        Path classesDir = targetDir.resolve("classes");
        Path dependencyDir = targetDir.resolve("dependency");

        if (!Files.isDirectory(classesDir)) {
            throw new IOException("未找到编译输出目录 'target/classes'。请先执行构建。");
        }

        List<String> classpathEntries = new ArrayList<>();
        classpathEntries.add(classesDir.toAbsolutePath().toString());
        Path testClassesDir = targetDir.resolve("test-classes");
        if (Files.isDirectory(testClassesDir)) {
            classpathEntries.add(testClassesDir.toAbsolutePath().toString());
        }
        if (Files.isDirectory(dependencyDir)) {
            try (var dependencyJars = Files.walk(dependencyDir)) {
                dependencyJars
                        .filter(path -> path.toString().endsWith(".jar"))
                        .map(path -> path.toAbsolutePath().toString())
                        .forEach(classpathEntries::add);
            }
        }
        return String.join(File.pathSeparator, classpathEntries);
    }
}
