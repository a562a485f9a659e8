package com.selectai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Select AI Agent 客户端启动类。
 * <p>
 * 位于顶层包路径，扫描 domain / infrastructure 各模块中的组件。
 * </p>
 *
 * @author selectai
 * @since 2025-06-10
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    /**
     * 应用程序主入口。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args){
        SpringApplication.run(Application.class, args);
    }

}
