package com.pedromossi.clinicache.clinic;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cacheable projection of the patient fields that screening eligibility depends on.
 */
public class PatientDemographics {

    private Long id;
    private Integer age;
    private String sex;
    private LocalDate dateOfBirth;
    private List<String> conditions = new ArrayList<>();

    public PatientDemographics() {
    }

    public PatientDemographics(Long id, Integer age, String sex, LocalDate dateOfBirth, List<String> conditions) {
        this.id = id;
        this.age = age;
        this.sex = sex;
        this.dateOfBirth = dateOfBirth;
        this.conditions = conditions == null ? new ArrayList<>() : new ArrayList<>(conditions);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public String getSex() {
        return sex;
    }

    public void setSex(String sex) {
        this.sex = sex;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public void setConditions(List<String> conditions) {
        this.conditions = conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatientDemographics that)) {
            return false;
        }
        return Objects.equals(id, that.id) && Objects.equals(age, that.age) && Objects.equals(sex, that.sex)
                && Objects.equals(dateOfBirth, that.dateOfBirth) && Objects.equals(conditions, that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, age, sex, dateOfBirth, conditions);
    }

    @Override
    public String toString() {
        return "PatientDemographics{id=" + id + ", age=" + age + ", sex='" + sex + "'}";
    }
}
