package com.yourcompany.fakeidp.saml;

import org.apache.commons.text.StringEscapeUtils;
import org.apache.velocity.VelocityContext;
import org.apache.velocity.app.VelocityEngine;
import org.apache.velocity.runtime.RuntimeConstants;
import org.apache.velocity.runtime.resource.loader.ClasspathResourceLoader;

import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Renders the HTTP-POST binding page: a form posting {@code SAMLResponse} and {@code RelayState} to the ACS,
 * submitted on load. Values are HTML escaped before they reach the template.
 */
public class PostBindingRenderer {

    static final String POST_BINDING_VM = "templates/saml2-post-binding.vm";

    private final VelocityEngine velocityEngine;

    public PostBindingRenderer() {
        velocityEngine = new VelocityEngine();
        velocityEngine.setProperty(RuntimeConstants.RESOURCE_LOADERS, "classpath");
        velocityEngine.setProperty("resource.loader.classpath.class", ClasspathResourceLoader.class.getName());
        velocityEngine.init();
    }

    /**
     * @param action       ACS URL the form posts to
     * @param samlResponse base64 encoded response document
     * @param relayState   opaque SP state, omitted from the form when blank
     * @return complete HTML page
     */
    public String render(String action, String samlResponse, String relayState) {
        Map<String, Object> model = new HashMap<>();
        model.put("action", StringEscapeUtils.escapeHtml4(action));
        model.put(FakeIdpServlet.SAML_RESPONSE, StringEscapeUtils.escapeHtml4(samlResponse));
        if (relayState != null && !relayState.isBlank()) {
            model.put(FakeIdpServlet.RELAY_STATE, StringEscapeUtils.escapeHtml4(relayState));
        }

        StringWriter out = new StringWriter();
        velocityEngine.mergeTemplate(POST_BINDING_VM, UTF_8.name(), new VelocityContext(model), out);
        return out.toString();
    }
}
