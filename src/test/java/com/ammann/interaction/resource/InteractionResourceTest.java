/* (C)2026 */
package com.ammann.interaction.resource;

import static com.ammann.interaction.support.TestDataFactory.labels;
import static com.ammann.interaction.support.TestDataFactory.template;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.interaction.dto.InteractionTemplateDTO;
import com.ammann.interaction.service.InteractionTemplateRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

class InteractionResourceTest {

    @Test
    void listsConfiguredTemplatesInNameOrder() {
        InteractionResource resource = new InteractionResource();
        resource.registry =
                new InteractionTemplateRegistry(
                        List.of(
                                template("Ride", labels("cat"), labels("bicycle"), 0.3, 6, 4),
                                template("Pet", labels("person"), labels("dog"), 0.5, 5, 5)));

        List<InteractionTemplateDTO> templates = resource.listInteractions();

        assertThat(templates).extracting(InteractionTemplateDTO::name).containsExactly("Pet", "Ride");
        assertThat(templates.get(1).threshold()).isEqualTo(0.3);
        assertThat(templates.get(1).minSustainSeconds()).isEqualTo(6.0);
        assertThat(templates.get(1).expireAfterSeconds()).isEqualTo(4.0);
    }
}
