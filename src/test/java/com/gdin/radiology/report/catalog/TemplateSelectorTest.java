package com.gdin.radiology.report.catalog;

import com.gdin.radiology.report.exception.TemplateNotFoundException;
import com.gdin.radiology.report.models.Template;
import com.gdin.radiology.report.util.IOUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TemplateSelectorTest {
    @Mock
    private TemplateCatalog templateCatalog;

    @InjectMocks
    private TemplateSelector templateSelector;

    private static Template template(String id, String title, String... keywords) {
        return Template.builder().id(id).title(title).keywords(List.of(keywords)).skeleton("{indication}").build();
    }

    @Test
    public void testAnatomicalHitBeatsSeveralGenericHits() {
        Template a = template("a", "Alpha Study", "brain");
        Template b = template("b", "Beta Study", "sudden", "severe", "acute");
        String indication = "sudden severe acute brain symptoms";

        assertEquals(10, templateSelector.score(indication, a));
        assertEquals(3, templateSelector.score(indication, b));
        assertEquals("a", templateSelector.select(indication, List.of(b, a)).orElseThrow().getId());
    }

    @Test
    public void testKeywordWeightTiers() {
        assertEquals(10, TemplateSelector.keywordWeight("pulmonary embolism"));
        assertEquals(3, TemplateSelector.keywordWeight("embolism"));
        assertEquals(1, TemplateSelector.keywordWeight("dyspnea"));
    }

    @Test
    public void testTitleWordGivesBonus() {
        Template t = template("t", "Knee MRI", "meniscus");
        // knee 同时是标题词，标题加分 5
        assertEquals(5, templateSelector.score("pain in the knee", t));
    }

    @Test
    public void testSelectionIsDeterministicAndTiesKeepCatalogOrder() {
        Template first = template("first", "One", "cough");
        Template second = template("second", "Two", "cough");
        List<Template> templates = List.of(first, second);

        for (int i = 0; i < 5; i++) {
            assertEquals("first", templateSelector.select("chronic cough", templates).orElseThrow().getId());
        }
    }

    @Test
    public void testEmptyCatalogSelectsNothing() {
        assertTrue(templateSelector.select("anything", List.of()).isEmpty());
        assertTrue(templateSelector.select("anything", null).isEmpty());

        when(templateCatalog.listActiveTemplates()).thenReturn(List.of());
        TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class,
                () -> templateSelector.resolve("auto", "anything"));
        assertEquals("auto", e.getTemplateId());
    }

    @Test
    public void testNoScoreFallsBackToFirstTemplate() {
        Template first = template("first", "One", "xyz");
        Template second = template("second", "Two", "abc");
        assertEquals("first", templateSelector.select("nothing relevant here", List.of(first, second)).orElseThrow().getId());
    }

    @Test
    public void testExplicitTemplateLookup() {
        Template active = template("ctpa_pe", "CTPA", "pe");
        Template inactive = Template.builder().id("old").title("Old").keywords(List.of()).skeleton("").active(false).build();
        when(templateCatalog.getTemplate("ctpa_pe")).thenReturn(Optional.of(active));
        when(templateCatalog.getTemplate("old")).thenReturn(Optional.of(inactive));
        when(templateCatalog.getTemplate("missing")).thenReturn(Optional.empty());

        assertEquals(active, templateSelector.resolve("ctpa_pe", "whatever"));
        assertThrows(TemplateNotFoundException.class, () -> templateSelector.resolve("old", "whatever"));
        TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class,
                () -> templateSelector.resolve("missing", "whatever"));
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    public void testBundledCatalogPicksCtpaForSuspectedPe() throws Exception {
        List<Template> templates;
        try (InputStream is = getClass().getResourceAsStream("/templates/radiology-templates.json")) {
            assertNotNull(is);
            templates = IOUtil.jsonDeserializeList(is, Template.class);
        }
        List<Template> active = templates.stream().filter(Template::isActive).toList();
        assertFalse(active.isEmpty());

        Template picked = templateSelector.select("65yo with acute dyspnea, rule out PE", active).orElseThrow();
        assertEquals("ctpa_pe", picked.getId());
        assertEquals("CT", picked.getCategory());
    }
}
