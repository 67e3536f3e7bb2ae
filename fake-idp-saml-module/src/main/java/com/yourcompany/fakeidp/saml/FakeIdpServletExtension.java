package com.yourcompany.fakeidp.saml;

import io.undertow.servlet.ServletExtension;
import io.undertow.servlet.api.DeploymentInfo;
import io.undertow.servlet.api.ServletInfo;
import jakarta.servlet.ServletContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extension Undertow qui enregistre la servlet SSO de l'IdP factice pour chaque déploiement.
 */
public class FakeIdpServletExtension implements ServletExtension {

    public static final String SERVLET_NAME = "FakeIdpServlet";
    public static final String SERVLET_MAPPING = "/saml/auth";

    private static final Logger LOGGER = LoggerFactory.getLogger(FakeIdpServletExtension.class);

    @Override
    public void handleDeployment(DeploymentInfo deploymentInfo, ServletContext servletContext) {
        LOGGER.info("Entrée handleDeployment - enregistrement de la servlet IdP");
        ServletInfo servletInfo = new ServletInfo(SERVLET_NAME, FakeIdpServlet.class)
                .addMapping(SERVLET_MAPPING)
                .setLoadOnStartup(1)
                .setAsyncSupported(false);
        deploymentInfo.addServlet(servletInfo);
        LOGGER.info("Sortie handleDeployment - servlet IdP enregistrée sur {}", SERVLET_MAPPING);
    }
}
