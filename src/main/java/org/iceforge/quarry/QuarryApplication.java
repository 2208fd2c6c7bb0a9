package org.iceforge.quarry;

import org.iceforge.quarry.config.StoreProperties;
import org.iceforge.quarry.filecache.FileCacheProperties;
import org.iceforge.quarry.cache.ResultCacheProperties;
import org.iceforge.quarry.quota.QuotaProperties;
import org.iceforge.quarry.worker.WorkerPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({WorkerPoolProperties.class, FileCacheProperties.class,
        ResultCacheProperties.class, QuotaProperties.class, StoreProperties.class})
public class QuarryApplication {

	public static void main(String[] args) {
		SpringApplication.run(QuarryApplication.class, args);
	}
}
