package io.github.cyfko.entityql.jpa.entities;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "test_player")
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    private Integer score;

    private String team;

    private String nickname;

    @Enumerated(EnumType.STRING)
    private Status status;

    private LocalDate joinedOn;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "test_player_tags", joinColumns = @JoinColumn(name = "player_id"))
    @Column(name = "tag")
    private Set<String> tags = new HashSet<>();

    public Player() {
    }

    public Player(String name, Integer score, String team, String nickname, Status status, LocalDate joinedOn, Set<String> tags) {
        this.name = name;
        this.score = score;
        this.team = team;
        this.nickname = nickname;
        this.status = status;
        this.joinedOn = joinedOn;
        this.tags = new HashSet<>(tags);
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Integer getScore() {
        return score;
    }

    public String getTeam() {
        return team;
    }

    public String getNickname() {
        return nickname;
    }

    public Status getStatus() {
        return status;
    }

    public LocalDate getJoinedOn() {
        return joinedOn;
    }

    public Set<String> getTags() {
        return tags;
    }

    public enum Status {
        ACTIVE, INACTIVE, PENDING
    }
}
