package com.example.circlecrawler.metadata;

public enum SourceType {
    CIRCLECI
}
