package com.dadtutor.taxonomy;

public interface ClassifiableItem {

    String subject();

    String topic();

    default String classificationText() {
        if (subject() != null) return subject();
        if (topic() != null) return topic();
        return "";
    }
}
