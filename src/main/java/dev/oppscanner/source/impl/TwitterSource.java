package dev.oppscanner.source.impl;

import dev.oppscanner.config.SourcesConfig;
import dev.oppscanner.model.Platform;
import org.springframework.stereotype.Component;

@Component
public class TwitterSource extends CredentialGatedSource {

    public TwitterSource(SourcesConfig sourcesConfig) {
        super(Platform.TWITTER, sourcesConfig);
    }
}
