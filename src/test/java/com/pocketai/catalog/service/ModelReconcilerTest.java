package com.pocketai.catalog.service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.pocketai.catalog.hub.HubModelDescriptor;
import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.CatalogModel;
import com.pocketai.catalog.model.LicenseKind;
import com.pocketai.catalog.model.ModelCategory;
import com.pocketai.catalog.model.NewModelRecord;
import com.pocketai.catalog.repo.CatalogSession;

class ModelReconcilerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 3, 0, 0, 0, ZoneOffset.UTC);

    private ModelReconciler reconciler;
    private AuthorReference author;

    @BeforeEach
    void setUp() {
        reconciler = new ModelReconciler("https://huggingface.co");
        author = new AuthorReference(UUID.randomUUID(), SystemAuthorResolver.SYSTEM_USERNAME);
    }

    @Test
    void reconcile_createsRecord_whenNoneExists() {
        HubModelDescriptor descriptor = HubModelDescriptor.builder("Google/MobileNet")
                .displayName("MobileNet")
                .description("Image classifier")
                .tags(List.of("TFLite", "vision"))
                .task("image-classification")
                .license("apache-2.0")
                .url("https://huggingface.co/Google/MobileNet")
                .build();

        CatalogMutation mutation = reconciler.reconcile(descriptor, null, author, NOW);

        assertEquals(CatalogMutation.Kind.CREATE, mutation.getKind());
        NewModelRecord record = mutation.getNewRecord();
        assertEquals("MobileNet", record.getName());
        assertEquals("google-mobilenet", record.getSlug());
        assertEquals("Google/MobileNet", record.getExternalId());
        assertEquals(ModelCategory.UTILITY, record.getCategory());
        assertEquals(author, record.getAuthor());
        assertEquals(NOW, record.getCreatedAt());
        assertEquals("Image classifier", record.getMetadata().getDescription());
        assertEquals(Set.of("tflite", "vision"), record.getMetadata().getTags());
        assertEquals("image-classification", record.getMetadata().getTask());
        assertEquals(LicenseKind.APACHE_2_0, record.getMetadata().getLicenseKind());
        assertEquals("https://huggingface.co/Google/MobileNet", record.getMetadata().getOriginUrl());
    }

    @Test
    void reconcile_updatesExistingRecord_evenWhenUnchanged() {
        UUID recordId = UUID.randomUUID();
        CatalogModel existing = new CatalogModel();
        existing.setId(recordId);
        existing.setHfModelId("org/m");
        HubModelDescriptor descriptor = HubModelDescriptor.builder("org/m").build();

        CatalogMutation first = reconciler.reconcile(descriptor, existing, author, NOW);
        CatalogMutation second = reconciler.reconcile(descriptor, existing, author, NOW.plusDays(1));

        assertEquals(CatalogMutation.Kind.UPDATE, first.getKind());
        assertEquals(CatalogMutation.Kind.UPDATE, second.getKind());
        assertEquals(recordId, first.getRecordId());
        assertEquals(NOW, first.getAt());
        assertEquals(NOW.plusDays(1), second.getAt());
        assertNull(first.getNewRecord());
        assertEquals(first.getMetadata(), second.getMetadata());
        assertEquals(LicenseKind.UNKNOWN, first.getMetadata().getLicenseKind());
        assertEquals("Model synced from Hugging Face: org/m", first.getMetadata().getDescription());
        assertNull(first.getMetadata().getTask());
    }

    @Test
    void reconcile_rejectsBlankExternalId() {
        HubModelDescriptor descriptor = HubModelDescriptor.builder("  ").build();

        assertThrows(ItemMappingException.class, () -> reconciler.reconcile(descriptor, null, author, NOW));
    }

    @Test
    void applyTo_routesMutationToSession() {
        CatalogSession session = mock(CatalogSession.class);
        UUID recordId = UUID.randomUUID();
        CatalogModel existing = new CatalogModel();
        existing.setId(recordId);

        CatalogMutation create = reconciler.reconcile(HubModelDescriptor.builder("a/new").build(), null, author, NOW);
        CatalogMutation update = reconciler.reconcile(HubModelDescriptor.builder("a/old").build(), existing, author, NOW);
        create.applyTo(session);
        update.applyTo(session);

        verify(session).insert(create.getNewRecord());
        verify(session).updateMetadata(recordId, update.getMetadata(), NOW);
        verifyNoMoreInteractions(session);
    }
}
