package com.cleanbear.assignment.dto;

import java.util.List;

public class TechnicianRecord {

    private String technicianId;
    private String name;
    private String phone;
    private String area;
    private Double homeLat;
    private Double homeLng;
    private String homeAddress;
    private List<String> serviceTypes;
    private Boolean overtimeAllowed;

    public TechnicianRecord() {}

    public String getTechnicianId() { return technicianId; }
    public String getName() { return name; }
    public String getPhone() { return phone; }
    public String getArea() { return area; }
    public Double getHomeLat() { return homeLat; }
    public Double getHomeLng() { return homeLng; }
    public String getHomeAddress() { return homeAddress; }
    public List<String> getServiceTypes() { return serviceTypes; }
    public Boolean getOvertimeAllowed() { return overtimeAllowed; }

    public void setTechnicianId(String technicianId) { this.technicianId = technicianId; }
    public void setName(String name) { this.name = name; }
    public void setPhone(String phone) { this.phone = phone; }
    public void setArea(String area) { this.area = area; }
    public void setHomeLat(Double homeLat) { this.homeLat = homeLat; }
    public void setHomeLng(Double homeLng) { this.homeLng = homeLng; }
    public void setHomeAddress(String homeAddress) { this.homeAddress = homeAddress; }
    public void setServiceTypes(List<String> serviceTypes) { this.serviceTypes = serviceTypes; }
    public void setOvertimeAllowed(Boolean overtimeAllowed) { this.overtimeAllowed = overtimeAllowed; }
}
