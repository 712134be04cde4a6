package com.skillbox.runtime.skill;

public class SkillNotFoundException extends SkillException {

    private final String skillName;

    public SkillNotFoundException(String skillName) {
        super(Kind.NOT_FOUND, "No skill installed with name: '" + skillName + "'");
        this.skillName = skillName;
    }

    public String getSkillName() { return skillName; }
}
