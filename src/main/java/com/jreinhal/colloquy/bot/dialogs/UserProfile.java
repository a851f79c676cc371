package com.jreinhal.colloquy.bot.dialogs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfile {
    private String name;
    private Integer age;

    public UserProfile() {}

    public UserProfile(String name, Integer age) {
        this.name = name;
        this.age = age;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    /**
     * Null when the user chose not to give it.
     */
    public Integer getAge() { return age; }
    public void setAge(Integer age) { this.age = age; }
}
