package org.carball.querycollector.model.query;

public enum QueryStatus {
    OK,
    ERROR
}
