package com.task4ge.api.task.dto;

import lombok.Data;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.multipart.MultipartFile;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Multipart form of {@code POST /task} and {@code PUT /task}. {@code id} and {@code completed}
 * are read on update only.
 */
@Data
public class TaskForm {

  private String id;
  private String name;
  private String description;

  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
  private OffsetDateTime startDate;

  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
  private OffsetDateTime endDate;

  private String priority;
  private Boolean completed;
  private List<MultipartFile> images = new ArrayList<>();
}
