package com.phillippitts.lineaccuracy.config.accuracy;

import com.phillippitts.lineaccuracy.service.match.DefaultWordComparator;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTableLoader;
import com.phillippitts.lineaccuracy.service.match.WordTables;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class AccuracyConfig {

    @Bean
    public WordTables wordTables(AccuracyProperties props, ResourceLoader resourceLoader) {
        AccuracyProperties.WordTableLocations locations = props.getWordTables();
        return new WordTableLoader(resourceLoader)
                .load(locations.getEquivalents(), locations.getSkippable(), locations.getFillers());
    }

    @Bean
    public WordComparator wordComparator(WordTables wordTables, AccuracyProperties props) {
        return new DefaultWordComparator(wordTables, props.getNameSimilarityThreshold());
    }
}
