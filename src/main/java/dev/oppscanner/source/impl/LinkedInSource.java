package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.Platform;
import org.springframework.stereotype.Component;

@Component
public class LinkedInSource extends CredentialGatedSource {

    public LinkedInSource(SourcesConfig sourcesConfig) {
        super(Platform.LINKEDIN, sourcesConfig);
    }
}
