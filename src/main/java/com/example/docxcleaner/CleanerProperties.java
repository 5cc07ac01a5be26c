package com.example.docxcleaner;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** docx-cleaner.* 配置项（application.properties / 命令行 --docx-cleaner.xxx=） */
@Data
@ConfigurationProperties(prefix = "docx-cleaner")
public class CleanerProperties {

    public enum TimestampPolicy { PRESERVE, NOW }

    /** 字符清单 JSON；为空时使用内置 docx-cleaner-chars.json */
    private String charsFile;

    /** 输出文件已存在时是否覆盖 */
    private boolean overwrite = false;

    /** 部件改写并发数，1 = 串行 */
    private int parallelism = 1;

    /** 被改写条目的时间戳：沿用原值或取当前时间 */
    private TimestampPolicy timestampPolicy = TimestampPolicy.PRESERVE;

    /** 改写后条目的 deflate 级别，-1 为默认 */
    private int compressionLevel = -1;

    /** 默认输出文件名后缀：a.docx -> a_cleaned.docx */
    private String outputSuffix = "_cleaned";
}
