package com.yourcompany.fakeidp.saml;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Base64;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Servlet SSO de l'IdP factice : reçoit un {@code SAMLRequest} (GET en HTTP-Redirect, POST en HTTP-POST) et
 * renvoie un formulaire auto-soumis qui POSTe une SAMLResponse signée vers l'ACS du fournisseur de service.
 * <p>
 * Aucune étape de connexion : l'utilisateur est celui de la configuration.
 * Enregistrée automatiquement via Undertow {@link FakeIdpServletExtension}; aucun WAR ou web.xml n'est requis.
 */
public class FakeIdpServlet extends HttpServlet {

    public static final String SAML_REQUEST = "SAMLRequest";
    public static final String SAML_RESPONSE = "SAMLResponse";
    public static final String RELAY_STATE = "RelayState";

    private static final long serialVersionUID = 1L;
    private static final Logger LOGGER = LoggerFactory.getLogger(FakeIdpServlet.class);
    private static final PostBindingRenderer POST_BINDING = new PostBindingRenderer();

    private transient FakeIdpConfig config;
    private transient SamlResponseBuilder responseBuilder;

    public FakeIdpServlet() {
        // Configuration résolue dans init() depuis les propriétés système.
    }

    FakeIdpServlet(FakeIdpConfig config, SamlResponseBuilder responseBuilder) {
        this.config = config;
        this.responseBuilder = responseBuilder;
    }

    @Override
    public void init() throws ServletException {
        if (config != null) {
            return;
        }
        try {
            config = FakeIdpConfig.from((java.util.Map) System.getProperties());
        } catch (SamlProcessingException | IllegalArgumentException e) {
            throw new ServletException("Configuration IdP factice invalide : " + e.getMessage(), e);
        }
        config.validatePaths().forEach(message -> LOGGER.warn("Avertissement de configuration : {}", message));
        responseBuilder = new SamlResponseBuilder();
        LOGGER.info("IdP factice initialisé avec {}", config);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        handle(req, resp);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        handle(req, resp);
    }

    private void handle(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        LOGGER.info("Entrée FakeIdpServlet.handle");
        String samlRequest = req.getParameter(SAML_REQUEST);
        String relayState = req.getParameter(RELAY_STATE);

        if (samlRequest == null || samlRequest.isBlank()) {
            LOGGER.info("Paramètre SAMLRequest manquant");
            resp.sendError(HttpServletResponse.SC_BAD_REQUEST, "SAMLRequest manquant");
            return;
        }

        String requestId;
        try {
            requestId = SamlUtils.extractRequestId(samlRequest);
        } catch (SamlProcessingException e) {
            LOGGER.info("SAMLRequest illisible : {}", e.getMessage());
            resp.sendError(HttpServletResponse.SC_BAD_REQUEST, "SAMLRequest illisible");
            return;
        }

        String samlResponse;
        try {
            samlResponse = responseBuilder.build(config.toResponseRequest(requestId));
        } catch (SamlProcessingException e) {
            LOGGER.error("Echec de construction de la SAMLResponse pour {} : {}", requestId, e.getMessage(), e);
            resp.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Impossible de construire la SAMLResponse");
            return;
        }

        resp.setContentType("text/html");
        resp.setCharacterEncoding(UTF_8.name());
        resp.setHeader("Cache-Control", "no-cache, no-store");
        PrintWriter writer = resp.getWriter();
        writer.write(POST_BINDING.render(config.getCallbackUrl(),
                Base64.getEncoder().encodeToString(samlResponse.getBytes(UTF_8)), relayState));
        writer.flush();
        LOGGER.info("Sortie FakeIdpServlet.handle");
    }
}
