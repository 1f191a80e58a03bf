package com.localization.generator.codegen.render;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.model.core.context.GeneratorConfig;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Wraps rendered declarations into a complete compilation unit: header,
 * package clause, imports and the package-private lookup helper class.
 */
public class SourceFileRenderer {
    private static final Logger log = LoggerFactory.getLogger(SourceFileRenderer.class);

    static final String TEMPLATE_NAME = "localizations.java.ftl";

    private final Configuration freemarkerConfig;

    public SourceFileRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(GeneratorConfig config, String declarations) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("packageName", config.hasPackage() ? config.getPackageName().trim() : "");
        model.put("topLevelName", config.getTopLevelName());
        model.put("lookupClassName", config.getLookupClassName());
        model.put("bundleName", config.getBundleName());
        model.put("declarations", declarations);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render template " + TEMPLATE_NAME, e);
        }

        log.debug("Rendered {} ({} characters)", TEMPLATE_NAME, out.getBuffer().length());
        return out.toString();
    }
}
