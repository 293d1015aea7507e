package com.teamstash.backend.modules.tag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.tag.application.TagReconcileResult;
import com.teamstash.backend.modules.tag.application.TagReconciler;
import com.teamstash.backend.modules.tag.domain.ItemTagLink;
import com.teamstash.backend.modules.tag.domain.Tag;
import com.teamstash.backend.modules.tag.infrastructure.persistence.ItemTagLinkRepository;
import com.teamstash.backend.modules.tag.infrastructure.persistence.TagRepository;
import com.teamstash.backend.modules.team.domain.Team;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TagReconcilerTest {

    private static final UUID TEAM_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID ITEM_ID = UUID.fromString("00000000-0000-0000-0000-00000000d001");
    private static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");

    @Mock
    private TagRepository tagRepository;

    @Mock
    private ItemTagLinkRepository itemTagLinkRepository;

    private TagReconciler reconciler;
    private Team team;
    private Tag food;
    private Tag dairy;
    private Tag frozen;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        reconciler = new TagReconciler(tagRepository, itemTagLinkRepository, clock);
        team = new Team("Groceries", ACTOR_ID);
        ReflectionTestUtils.setField(team, "id", TEAM_ID);
        food = tag("food", "00000000-0000-0000-0000-00000000e001");
        dairy = tag("dairy", "00000000-0000-0000-0000-00000000e002");
        frozen = tag("frozen", "00000000-0000-0000-0000-00000000e003");
    }

    @Test
    void unlinksDroppedTagsAndCreatesMissingOnes() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID))
                .thenReturn(List.of(new ItemTagLink(ITEM_ID, food), new ItemTagLink(ITEM_ID, dairy)));
        when(tagRepository.findByTeamIdAndNormalizedNameIn(eq(TEAM_ID), anyCollection()))
                .thenReturn(List.of(), List.of(frozen));
        when(tagRepository.insertIfAbsent(any(UUID.class), eq(TEAM_ID), eq("frozen"), eq(ACTOR_ID), any(OffsetDateTime.class)))
                .thenReturn(1);

        TagReconcileResult result = reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of("Dairy", "frozen"));

        verify(itemTagLinkRepository).deleteLinks(ITEM_ID, List.of(food.getId()));
        verify(itemTagLinkRepository).insertIfAbsent(ITEM_ID, frozen.getId());
        verify(itemTagLinkRepository, never()).insertIfAbsent(ITEM_ID, dairy.getId());
        assertThat(result.desiredNames()).containsExactly("dairy", "frozen");
        assertThat(result.unlinkedTagIds()).containsExactly(food.getId());
        assertThat(result.attachedTagIds()).containsExactly(frozen.getId());
        assertThat(result.createdNames()).containsExactly("frozen");
    }

    @Test
    void matchingStateWritesNothing() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID))
                .thenReturn(List.of(new ItemTagLink(ITEM_ID, dairy), new ItemTagLink(ITEM_ID, frozen)));

        TagReconcileResult result = reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of("FROZEN", " dairy ", "dairy"));

        assertThat(result.isNoop()).isTrue();
        verify(itemTagLinkRepository, never()).deleteLinks(any(), anyCollection());
        verify(tagRepository, never()).findByTeamIdAndNormalizedNameIn(any(), anyCollection());
        verify(itemTagLinkRepository, never()).insertIfAbsent(any(), any());
    }

    @Test
    void existingTeamTagIsReusedNotCreated() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID)).thenReturn(List.of());
        when(tagRepository.findByTeamIdAndNormalizedNameIn(eq(TEAM_ID), anyCollection())).thenReturn(List.of(food));

        TagReconcileResult result = reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of("Food"));

        verify(tagRepository, never()).insertIfAbsent(any(), any(), anyString(), any(), any());
        verify(itemTagLinkRepository).insertIfAbsent(ITEM_ID, food.getId());
        assertThat(result.createdNames()).isEmpty();
    }

    @Test
    void tagCreatedConcurrentlyIsPickedUpOnRequery() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID)).thenReturn(List.of());
        when(tagRepository.findByTeamIdAndNormalizedNameIn(eq(TEAM_ID), anyCollection()))
                .thenReturn(List.of(), List.of(frozen));
        when(tagRepository.insertIfAbsent(any(UUID.class), eq(TEAM_ID), eq("frozen"), eq(ACTOR_ID), any(OffsetDateTime.class)))
                .thenReturn(0);

        TagReconcileResult result = reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of("frozen"));

        verify(itemTagLinkRepository).insertIfAbsent(ITEM_ID, frozen.getId());
        assertThat(result.createdNames()).isEmpty();
        assertThat(result.attachedTagIds()).containsExactly(frozen.getId());
    }

    @Test
    void emptyDesiredSetUnlinksEverything() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID))
                .thenReturn(List.of(new ItemTagLink(ITEM_ID, food), new ItemTagLink(ITEM_ID, dairy)));

        TagReconcileResult result = reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of());

        verify(itemTagLinkRepository).deleteLinks(ITEM_ID, List.of(food.getId(), dairy.getId()));
        assertThat(result.attachedTagIds()).isEmpty();
        verify(tagRepository, never()).insertIfAbsent(any(), any(), anyString(), any(), any());
    }

    @Test
    void unresolvableTagFailsTheStep() {
        when(itemTagLinkRepository.findByItemIdWithTag(ITEM_ID)).thenReturn(List.of());
        when(tagRepository.findByTeamIdAndNormalizedNameIn(eq(TEAM_ID), anyCollection())).thenReturn(List.of());
        when(tagRepository.insertIfAbsent(any(UUID.class), eq(TEAM_ID), eq("ghost"), eq(ACTOR_ID), any(OffsetDateTime.class)))
                .thenReturn(0);

        assertThatThrownBy(() -> reconciler.reconcile(ITEM_ID, TEAM_ID, ACTOR_ID, List.of("ghost")))
                .isInstanceOf(IllegalStateException.class);
        verify(itemTagLinkRepository, never()).insertIfAbsent(any(), any());
    }

    private Tag tag(String name, String id) {
        Tag tag = new Tag(team, name, ACTOR_ID);
        ReflectionTestUtils.setField(tag, "id", UUID.fromString(id));
        return tag;
    }
}
