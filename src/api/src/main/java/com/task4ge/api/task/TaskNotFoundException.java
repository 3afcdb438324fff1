package com.task4ge.api.task;

public class TaskNotFoundException extends RuntimeException {
}
