package com.fitnexus.backend.support;

import java.lang.reflect.Field;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

/**
 * Entity builders for unit tests. Ids normally come from Hibernate, so they are set reflectively.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static GymUser user(UUID id, GymRole role, String branch) {
        GymUser user = new GymUser();
        user.setEmail(role.code() + "-" + id.toString().substring(0, 8) + "@fitnexus.test");
        user.setPasswordHash("hash");
        user.setFullName(role.code() + " " + id.toString().substring(0, 4));
        user.setPhone("555-0100");
        user.setRole(role);
        user.setBranch(branch);
        setId(user, GymUser.class, id);
        return user;
    }

    public static Trainer trainer(GymUser account) {
        Trainer trainer = new Trainer(account);
        trainer.setSpecialization("Yoga, Pilates");
        trainer.setRating(4.5);
        trainer.setExperience(6);
        trainer.setAvailability("Mon-Fri");
        setId(trainer, Trainer.class, account.getId());
        return trainer;
    }

    public static SessionSchedule session(UUID id, Trainer trainer, String branch) {
        SessionSchedule session = new SessionSchedule(trainer, branch);
        session.setSessionName("Yoga");
        session.setSessionDate(LocalDate.of(2024, 6, 1));
        session.setStartTime(LocalTime.of(7, 0));
        session.setEndTime(LocalTime.of(8, 0));
        setId(session, SessionSchedule.class, id);
        return session;
    }

    public static CallerContext caller(GymUser user) {
        return new CallerContext(user.getId(), user.getRole(), user.getBranch());
    }

    public static void setId(Object entity, Class<?> declaringType, UUID id) {
        try {
            Field idField = declaringType.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
