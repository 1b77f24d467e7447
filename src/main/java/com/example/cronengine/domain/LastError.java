package com.example.cronengine.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.Column;
import javax.persistence.Embeddable;
import javax.persistence.Lob;
import java.sql.Timestamp;

@Embeddable
@Getter @Setter @ToString
@NoArgsConstructor
@AllArgsConstructor
public class LastError {

    @Column(name = "last_error_message", length = 2000)
    private String message;

    @Lob
    @Column(name = "last_error_stack")
    @ToString.Exclude
    private String stack;

    @Column(name = "last_error_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp timestamp;
}
