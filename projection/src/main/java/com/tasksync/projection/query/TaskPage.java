package com.tasksync.projection.query;

import lombok.Value;

import java.util.List;

@Value
public class TaskPage {
    List<TaskView> tasks;
    boolean hasMore;
    /** Pass as {@code after} to fetch the next page; null on the last page. */
    String nextToken;
}
