package com.authgate.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

/** A client application; tokens are issued per app. */
@Data
@Table(name = "apps")
@Entity
public class App {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @ToString.Exclude
    @Column(nullable = false, unique = true, length = 255)
    private String secret;
}
