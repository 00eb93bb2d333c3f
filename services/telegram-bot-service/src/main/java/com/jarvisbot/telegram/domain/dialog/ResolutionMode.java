package com.jarvisbot.telegram.domain.dialog;

public enum ResolutionMode {
  LINK_OR_CREATE
}
