package org.smileyface.newscrawler;

import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.smileyface.newscrawler.enrichment.TranslationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({CrawlerProperties.class, TranslationProperties.class})
public class NewsCrawlerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(NewsCrawlerApplication.class, args)));
	}
}
