package com.tasksync.command.domain;

import com.tasksync.command.domain.TaskCommands.*;
import com.tasksync.shared.errors.ValidationException;
import com.tasksync.shared.events.EventIds;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Stateless input checks, run once before the load/decide/append cycle.
 *
 * Titles and descriptions are trimmed; an empty description becomes null; tags are trimmed
 * and de-duplicated in order. Returns the normalized command, or throws with every violation.
 */
@Component
public class CommandValidator {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;
    public static final int MAX_TAGS = 10;
    public static final int MAX_TAG_LENGTH = 50;

    public TaskCommand validate(TaskCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.getType() != CommandType.CREATE && !EventIds.isValid(command.getTaskId())) {
            errors.add("taskId is not a valid task id: " + command.getTaskId());
        }

        TaskCommand normalized = switch (command.getType()) {
            case CREATE -> {
                CreateTask create = (CreateTask) command;
                String title = requiredTitle(create.getTitle(), errors);
                yield new CreateTask(create.getContext(), title,
                        description(create.getDescription(), errors),
                        tags(create.getTags(), errors),
                        optionalAssignee(create.getAssigneeId(), errors));
            }
            case UPDATE -> {
                UpdateTask update = (UpdateTask) command;
                if (update.getTitle() == null && update.getDescription() == null && update.getTags() == null) {
                    errors.add("update must change at least one of title, description, tags");
                }
                String title = update.getTitle() == null ? null : requiredTitle(update.getTitle(), errors);
                // an explicit empty description clears it
                String description = update.getDescription() == null ? null
                        : nullToEmpty(description(update.getDescription(), errors));
                yield new UpdateTask(update.getContext(), update.getTaskId(), title, description,
                        update.getTags() == null ? null : tags(update.getTags(), errors));
            }
            case ASSIGN -> {
                AssignTask assign = (AssignTask) command;
                if (assign.getAssigneeId() == null || assign.getAssigneeId().isBlank()) {
                    errors.add("assigneeId must not be blank");
                    yield assign;
                }
                yield new AssignTask(assign.getContext(), assign.getTaskId(), assign.getAssigneeId().trim());
            }
            case DELETE -> {
                DeleteTask delete = (DeleteTask) command;
                String reason = delete.getReason() == null || delete.getReason().isBlank()
                        ? null : delete.getReason().trim();
                if (reason != null && reason.length() > MAX_DESCRIPTION_LENGTH) {
                    errors.add("reason must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
                }
                yield new DeleteTask(delete.getContext(), delete.getTaskId(), reason);
            }
            case COMPLETE, REOPEN -> command;
        };

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return normalized;
    }

    private String requiredTitle(String raw, List<String> errors) {
        String title = raw == null ? "" : raw.trim();
        if (title.isEmpty()) {
            errors.add("title must not be blank");
        } else if (title.length() > MAX_TITLE_LENGTH) {
            errors.add("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    private String description(String raw, List<String> errors) {
        if (raw == null) return null;
        String description = raw.trim();
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description.isEmpty() ? null : description;
    }

    private List<String> tags(List<String> raw, List<String> errors) {
        if (raw == null) return List.of();
        LinkedHashSet<String> tags = new LinkedHashSet<>();
        for (String tag : raw) {
            String t = tag == null ? "" : tag.trim();
            if (t.isEmpty()) {
                errors.add("tags must not be blank");
            } else if (t.length() > MAX_TAG_LENGTH) {
                errors.add("tag must be at most " + MAX_TAG_LENGTH + " characters: " + t.substring(0, 20) + "...");
            } else {
                tags.add(t);
            }
        }
        if (tags.size() > MAX_TAGS) {
            errors.add("at most " + MAX_TAGS + " tags allowed, got " + tags.size());
        }
        return List.copyOf(tags);
    }

    private String optionalAssignee(String raw, List<String> errors) {
        if (raw == null) return null;
        if (raw.isBlank()) {
            errors.add("assigneeId must not be blank when given");
            return null;
        }
        return raw.trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
