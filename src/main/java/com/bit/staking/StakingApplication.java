package com.bit.staking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.staking")
public class StakingApplication {
    public static void main(String[] args) {
        SpringApplication.run(StakingApplication.class, args);
        log.info("质押服务启动完成");
    }
    //时间统一为秒级时间戳
}
