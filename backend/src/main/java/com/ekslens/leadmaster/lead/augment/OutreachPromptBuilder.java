package com.ekslens.leadmaster.lead.augment;

import com.ekslens.leadmaster.lead.model.OutreachContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OutreachPromptBuilder {
    static final int MAX_WORDS = 150;

    public String build(OutreachContext context) {
        String leadName = context.leadName() == null ? "" : context.leadName().trim();
        StringBuilder prompt = new StringBuilder();
        prompt.append("Genera un email profesional y personalizado para contactar a \"")
            .append(leadName)
            .append("\" del sector ")
            .append(context.industry())
            .append(".\n\n");
        prompt.append("Contexto de la industria:\n");
        prompt.append("- Productos principales: ").append(join(context.products())).append('\n');
        prompt.append("- Servicios: ").append(join(context.services())).append('\n');
        prompt.append("- Audiencia objetivo: ").append(context.targetAudience()).append('\n');
        prompt.append("- Propuesta de valor: ").append(context.valueProposition()).append('\n');
        if (context.leadDescription() != null && !context.leadDescription().isBlank()) {
            prompt.append("- Sobre el contacto: ").append(context.leadDescription().trim()).append('\n');
        }
        prompt.append("\nEl email debe:\n");
        prompt.append("1. Ser profesional pero accesible\n");
        prompt.append("2. Mencionar productos específicos de ").append(context.industry()).append('\n');
        prompt.append("3. Ofrecer valor inmediato\n");
        prompt.append("4. Incluir un call-to-action claro\n");
        prompt.append("5. Ser personalizado para \"").append(leadName).append("\"\n\n");
        prompt.append("Longitud: Máximo ").append(MAX_WORDS).append(" palabras.\n");
        prompt.append("Tono: ").append(context.tone());
        return prompt.toString();
    }

    private static String join(List<String> values) {
        return values == null ? "" : String.join(", ", values);
    }
}
