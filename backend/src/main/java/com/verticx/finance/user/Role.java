package com.verticx.finance.user;

public enum Role {
    ADMIN, PRINCIPAL, REGISTRAR, TEACHER, STUDENT, PARENT, LIBRARIAN;

    public String authority() {
        return "ROLE_" + name();
    }
}
