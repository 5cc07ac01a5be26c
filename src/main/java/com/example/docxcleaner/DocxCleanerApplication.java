package com.example.docxcleaner;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(CleanerProperties.class)
public class DocxCleanerApplication {

    public static void main(String[] args) {
        String[] expanded = CommandLineCleaner.expandShorthand(args);

        // 带文件参数：不启动 Web，跑完即退出
        if (CommandLineCleaner.hasInput(expanded)) {
            ConfigurableApplicationContext ctx = new SpringApplicationBuilder(DocxCleanerApplication.class)
                    .web(WebApplicationType.NONE)
                    .bannerMode(Banner.Mode.OFF)
                    .logStartupInfo(false)
                    .run(expanded);
            System.exit(SpringApplication.exit(ctx));
        }

        SpringApplication.run(DocxCleanerApplication.class, expanded);
        System.out.println("DOCX Cleaner started: POST a .docx to http://localhost:8080/api/clean");
    }
}
