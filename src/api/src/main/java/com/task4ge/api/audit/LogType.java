package com.task4ge.api.audit;

public enum LogType {
  INSERT,
  UPDATE,
  DELETE
}
