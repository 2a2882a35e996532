package com.example.pharmacyrota.staff;

public enum StaffType {
    PHARMACIST,
    TECHNICIAN
}
