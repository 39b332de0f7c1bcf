package io.github.harrbca.x12delimiters.config;

import io.github.harrbca.x12delimiters.x12.Delimiters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app.delimiters")
public class DelimiterProperties {

    private boolean requireIsaTag = true;
    private boolean requireValid = false;

    // fallback set when a header cannot be read; each must fit in one byte
    private char segmentTerminator = '~';
    private char elementSeparator = '*';
    private char subElementSeparator = ':';

    public void setSegmentTerminator(char segmentTerminator) {
        Delimiters.code(segmentTerminator);
        this.segmentTerminator = segmentTerminator;
    }

    public void setElementSeparator(char elementSeparator) {
        Delimiters.code(elementSeparator);
        this.elementSeparator = elementSeparator;
    }

    public void setSubElementSeparator(char subElementSeparator) {
        Delimiters.code(subElementSeparator);
        this.subElementSeparator = subElementSeparator;
    }

    public Delimiters toDelimiters() {
        return new Delimiters(
                Delimiters.code(segmentTerminator),
                Delimiters.code(elementSeparator),
                Delimiters.code(subElementSeparator));
    }
}
