package com.tba3.mock.config;

import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.parser.BookletCsvParser;
import com.tba3.mock.parser.ConfigYamlParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(Tba3Properties.class)
public class CatalogConfiguration {

    @Bean
    public BookletCatalog bookletCatalog(BookletCsvParser parser, Tba3Properties properties) {
        return parser.loadDirectory(properties.metadataDir());
    }

    @Bean
    public ConfigStore configStore(ConfigYamlParser parser, Tba3Properties properties, BookletCatalog catalog) {
        return parser.load(properties.configDir(), catalog);
    }
}
