package com.lux032.coverart.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 国际化工具类
 * 加载 messages_{language}.properties，日志里的关键提示统一从这里取
 */
@Slf4j
public class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static Properties messages;
    private static String currentLanguage = DEFAULT_LANGUAGE;

    /**
     * 初始化国际化资源
     * @param language 语言代码，如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        Properties loaded = new Properties();

        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.error("i18n resource file not found: {}, falling back to default English", resourceFile);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            } else {
                messages = loaded;
            }
            return;
        }

        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
            log.debug("Loaded i18n resource file: {}", resourceFile);
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
        }

        currentLanguage = language;
        messages = loaded;
    }

    /**
     * 获取国际化消息
     * @param key 消息键
     * @return 对应语言的消息文本，如果找不到则返回键本身
     */
    public static String getMessage(String key) {
        return messages().getProperty(key, key);
    }

    /**
     * 获取国际化消息（支持 SLF4J 风格的 {} 占位符）
     * @param key 消息键
     * @param args 替换占位符的参数
     */
    public static String getMessage(String key, Object... args) {
        String pattern = messages().getProperty(key, key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return formatMessage(pattern, args);
    }

    private static String formatMessage(String pattern, Object... args) {
        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        int i = 0;

        while (i < pattern.length()) {
            if (i < pattern.length() - 1 && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    result.append(args[argIndex]);
                    argIndex++;
                } else {
                    result.append("{}");
                }
                i += 2;
            } else {
                result.append(pattern.charAt(i));
                i++;
            }
        }

        return result.toString();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }

    private static synchronized Properties messages() {
        if (messages == null) {
            init(currentLanguage);
        }
        return messages;
    }
}
