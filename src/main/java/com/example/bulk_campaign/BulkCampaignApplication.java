package com.example.bulk_campaign;

import java.time.Clock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class BulkCampaignApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkCampaignApplication.class, args);
    }

    // 開始日の過去判定・ファイル名のタイムスタンプはこの Clock を使う
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
