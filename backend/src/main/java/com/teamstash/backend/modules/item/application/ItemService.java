package com.teamstash.backend.modules.item.application;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.item.domain.Category;
import com.teamstash.backend.modules.item.domain.Item;
import com.teamstash.backend.modules.item.infrastructure.persistence.CategoryRepository;
import com.teamstash.backend.modules.item.infrastructure.persistence.ItemNoteRepository;
import com.teamstash.backend.modules.item.infrastructure.persistence.ItemRepository;
import com.teamstash.backend.modules.item.presentation.dto.ItemNoteResponse;
import com.teamstash.backend.modules.item.presentation.dto.ItemResponse;
import com.teamstash.backend.modules.provider.application.ProviderResolution;
import com.teamstash.backend.modules.provider.application.ProviderResolver;
import com.teamstash.backend.modules.provider.infrastructure.persistence.ProviderRepository;
import com.teamstash.backend.modules.tag.domain.ItemTagLink;
import com.teamstash.backend.modules.tag.infrastructure.persistence.ItemTagLinkRepository;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Item rows and their read models. Every write here commits on its own; tags are handled
 * afterwards by {@link ItemCommandService}.
 */
@Service
@Transactional
public class ItemService {

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    private final ItemRepository itemRepository;
    private final ItemNoteRepository itemNoteRepository;
    private final CategoryRepository categoryRepository;
    private final ItemTagLinkRepository itemTagLinkRepository;
    private final ProviderRepository providerRepository;
    private final ProviderResolver providerResolver;
    private final TeamRepository teamRepository;
    private final TeamRoleAuthorizer authorizer;

    public ItemService(
            ItemRepository itemRepository,
            ItemNoteRepository itemNoteRepository,
            CategoryRepository categoryRepository,
            ItemTagLinkRepository itemTagLinkRepository,
            ProviderRepository providerRepository,
            ProviderResolver providerResolver,
            TeamRepository teamRepository,
            TeamRoleAuthorizer authorizer
    ) {
        this.itemRepository = itemRepository;
        this.itemNoteRepository = itemNoteRepository;
        this.categoryRepository = categoryRepository;
        this.itemTagLinkRepository = itemTagLinkRepository;
        this.providerRepository = providerRepository;
        this.providerResolver = providerResolver;
        this.teamRepository = teamRepository;
        this.authorizer = authorizer;
    }

    @Transactional(readOnly = true)
    public List<ItemResponse> listItems(ActiveTeam activeTeam) {
        authorizer.require(activeTeam, TeamCapability.READ_DATA);
        List<Item> items = itemRepository.findAllByTeamId(activeTeam.teamId());
        Map<UUID, List<String>> tagsByItem = loadTagNames(items.stream().map(Item::getId).toList());
        return items.stream()
                .map(item -> toResponse(item, tagsByItem.getOrDefault(item.getId(), List.of()), null))
                .toList();
    }

    @Transactional(readOnly = true)
    public ItemResponse getItem(ActiveTeam activeTeam, UUID itemId) {
        authorizer.require(activeTeam, TeamCapability.READ_DATA);
        Item item = findItem(activeTeam.teamId(), itemId);
        List<String> tags = loadTagNames(List.of(itemId)).getOrDefault(itemId, List.of());
        List<ItemNoteResponse> notes = itemNoteRepository.findByItemIdNewestFirst(itemId).stream()
                .map(ItemNoteResponse::from)
                .toList();
        return toResponse(item, tags, notes);
    }

    public UUID createItem(ActiveTeam activeTeam, UUID principalId, ItemCommand command) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        Item item = new Item(teamRepository.getReferenceById(activeTeam.teamId()), principalId);
        apply(item, activeTeam, command);
        Item saved = itemRepository.saveAndFlush(item);
        log.info("Item created itemId={} teamId={} principalId={}", saved.getId(), activeTeam.teamId(), principalId);
        return saved.getId();
    }

    public void updateItem(ActiveTeam activeTeam, UUID principalId, UUID itemId, ItemCommand command) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        Item item = findItem(activeTeam.teamId(), itemId);
        apply(item, activeTeam, command);
        item.setModifierId(principalId);
        itemRepository.saveAndFlush(item);
    }

    /**
     * Notes and tag links go with the item; the tags themselves stay with the team.
     */
    public void deleteItem(ActiveTeam activeTeam, UUID principalId, UUID itemId) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        itemRepository.delete(findItem(activeTeam.teamId(), itemId));
        log.info("Item deleted itemId={} teamId={} principalId={}", itemId, activeTeam.teamId(), principalId);
    }

    @Transactional(readOnly = true)
    public Item findItem(UUID teamId, UUID itemId) {
        return itemRepository.findByIdAndTeamId(itemId, teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "item.not_found", "Item not found."));
    }

    private void apply(Item item, ActiveTeam activeTeam, ItemCommand command) {
        String name = command.name() == null ? "" : command.name().trim();
        if (name.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "item.invalid_name", "Item name is required.")
                    .withRejectedInput(rejected(command));
        }
        item.setName(name);
        item.setDescription(trimToNull(command.description()));
        item.setExpirationDate(command.expirationDate());
        item.setCategory(resolveCategory(command));

        ProviderResolution provider = providerResolver.resolve(activeTeam.teamId(), command.providerName());
        item.assignProvider(
                provider.linkedId().map(providerRepository::getReferenceById).orElse(null),
                provider.manualNameToStore().orElse(null));
    }

    private Category resolveCategory(ItemCommand command) {
        if (command.categoryId() == null) {
            return null;
        }
        return categoryRepository.findById(command.categoryId())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "item.invalid_category",
                        "Unknown category.").withRejectedInput(rejected(command)));
    }

    private Map<UUID, List<String>> loadTagNames(Collection<UUID> itemIds) {
        if (itemIds.isEmpty()) {
            return Map.of();
        }
        return itemTagLinkRepository.findByItemIdInWithTag(itemIds).stream()
                .collect(Collectors.groupingBy(
                        ItemTagLink::getItemId,
                        LinkedHashMap::new,
                        Collectors.mapping(link -> link.getTag().getName(), Collectors.toList())));
    }

    private static ItemResponse toResponse(Item item, List<String> tags, List<ItemNoteResponse> notes) {
        Category category = item.getCategory();
        UUID providerId = item.getProvider() != null ? item.getProvider().getId() : null;
        String providerName = item.getProvider() != null ? item.getProvider().getName() : item.getProviderNameManual();
        return new ItemResponse(
                item.getId(),
                item.getName(),
                item.getDescription(),
                category != null ? category.getId() : null,
                category != null ? category.getName() : null,
                item.getExpirationDate(),
                providerId,
                providerName,
                tags,
                item.getCreatorId(),
                item.getModifierId(),
                item.getCreatedAt(),
                item.getUpdatedAt(),
                notes
        );
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Map<String, Object> rejected(ItemCommand command) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", command.name());
        input.put("description", command.description());
        input.put("categoryId", command.categoryId());
        input.put("expirationDate", command.expirationDate());
        input.put("providerName", command.providerName());
        return input;
    }
}
