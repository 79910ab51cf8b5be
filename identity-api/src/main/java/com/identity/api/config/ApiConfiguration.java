package com.identity.api.config;

import com.identity.api.middleware.LocalizationTranslator;
import com.identity.api.middleware.Translator;
import com.identity.api.oidc.ClientCredentialsAuthenticator;
import com.identity.core.crypto.PasswordHasher;
import com.identity.core.repository.UserProjectionRepository;
import com.identity.engine.command.UserCommands;
import com.identity.engine.config.EngineConfiguration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Protocol-facing components on top of the engine.
 */
@Configuration
@Import(EngineConfiguration.class)
public class ApiConfiguration {

    @Bean
    public ClientCredentialsAuthenticator clientCredentialsAuthenticator(
            UserProjectionRepository userProjectionRepository,
            UserCommands userCommands,
            PasswordHasher passwordHasher) {
        return new ClientCredentialsAuthenticator(userProjectionRepository, userCommands, passwordHasher);
    }

    /**
     * Uses the application's {@link Translator} if one is defined, otherwise passes messages through.
     */
    @Bean
    public LocalizationTranslator localizationTranslator(ObjectProvider<Translator> translator) {
        return new LocalizationTranslator(translator.getIfAvailable());
    }
}
