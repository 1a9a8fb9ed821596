package com.mergeline.backend.acl;

import jakarta.persistence.*;

/**
 * A person known to the merge bot, identified by their remote login.
 */
@Entity
@Table(name = "partners")
public class PartnerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String login;

    @Column(name = "display_name")
    private String displayName;

    private String email;

    protected PartnerEntity() {}

    public PartnerEntity(String login) {
        this.login = login;
        this.displayName = login;
    }

    public Long getId() { return id; }

    public String getLogin() { return login; }
    public void setLogin(String login) { this.login = login; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
