package com.classsched.classsched_api.solver.facts;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.exception.DataIntegrityException;
import com.classsched.classsched_api.model.CourseInput;
import com.classsched.classsched_api.model.CurriculumInput;
import com.classsched.classsched_api.model.JointInput;
import com.classsched.classsched_api.model.SlotInput;
import com.classsched.classsched_api.model.TeacherInput;
import com.classsched.classsched_api.model.TimetableInput;
import com.classsched.classsched_api.model.WorkloadInput;
import com.classsched.classsched_api.solver.domain.PartOfDay;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timeslot;

/**
 * Validates a {@link TimetableInput} and turns it into a {@link FactStore}.
 * Every inconsistency that would make the search meaningless is reported as a
 * {@link DataIntegrityException} before any search starts.
 */
public class FactStoreBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FactStoreBuilder.class);

    public static final String DEFAULT_OFFERING_GROUP = "bcc";
    public static final Set<PartOfDay> DEFAULT_PARTS_OF_DAY = EnumSet.of(PartOfDay.MORNING, PartOfDay.AFTERNOON);

    private final SlotDomain slotDomain;

    public FactStoreBuilder(SlotDomain slotDomain) {
        this.slotDomain = slotDomain;
    }

    public FactStore build(TimetableInput input) {
        if (input == null) {
            throw new DataIntegrityException("No input facts were given.");
        }
        Map<String, Course> courses = buildCourses(nonNull(input.getCourses()));
        Map<String, Teacher> teachers = buildTeachers(nonNull(input.getTeachers()));

        Map<UnitKey, Unit> units = new LinkedHashMap<>();
        Set<UnitPair> joints = new HashSet<>();
        int row = 0;
        for (WorkloadInput workload : nonNull(input.getWorkload())) {
            row++;
            addWorkload(row, workload, courses, teachers, units, joints);
        }

        List<CurriculumMembership> curricula = buildCurricula(nonNull(input.getCurricula()), courses);

        for (JointInput joint : nonNull(input.getJoints())) {
            UnitKey a = UnitKey.of(normalizeCourseId(joint.getCourseA()), normalizeGroup(joint.getGroupA()));
            UnitKey b = UnitKey.of(normalizeCourseId(joint.getCourseB()), normalizeGroup(joint.getGroupB()));
            if (!units.containsKey(a) || !units.containsKey(b)) {
                throw new DataIntegrityException("Joint pair " + a + " & " + b + " references an undefined unit.");
            }
            if (a.equals(b)) {
                throw new DataIntegrityException("Unit " + a + " cannot be joint with itself.");
            }
            joints.add(UnitPair.of(a, b));
        }

        logger.info("Loaded facts: {} courses, {} teachers, {} units, {} curriculum entries, {} joint pairs",
                courses.size(), teachers.size(), units.size(), curricula.size(), joints.size());
        return new FactStore(slotDomain, courses, teachers, units, curricula, joints);
    }

    private Map<String, Course> buildCourses(List<CourseInput> inputs) {
        Map<String, Course> courses = new HashMap<>();
        for (CourseInput input : inputs) {
            String id = normalizeCourseId(input.getCourseId());
            if (input.getNumClasses() <= 0) {
                throw new DataIntegrityException("Course " + id + " must have a positive number of classes, got "
                        + input.getNumClasses() + ".");
            }
            if (input.getIdealSemester() < 0) {
                throw new DataIntegrityException("Course " + id + " has a negative ideal semester.");
            }
            if (input.getNumClasses() > slotDomain.size()) {
                throw new DataIntegrityException("Course " + id + " needs more classes than there are weekly slots.");
            }
            Course course = new Course(id, input.getNumClasses(), input.isDoubleClass(), input.isUndergrad(),
                    input.getIdealSemester());
            if (courses.put(id, course) != null) {
                throw new DataIntegrityException("Course " + id + " is defined more than once.");
            }
        }
        return courses;
    }

    private Map<String, Teacher> buildTeachers(List<TeacherInput> inputs) {
        Map<String, Teacher> teachers = new HashMap<>();
        for (TeacherInput input : inputs) {
            String id = normalizeTeacherId(input.getTeacherId());
            long available = input.getAvailable() == null
                    ? slotDomain.fullMask()
                    : toMask(input.getAvailable(), "availability of teacher " + id);
            long preferred = input.getPreferred() == null
                    ? 0L
                    : toMask(input.getPreferred(), "preferences of teacher " + id);
            if ((preferred & ~available) != 0L) {
                logger.warn("Teacher {} prefers slots they are not available in; ignoring {}",
                        id, slotDomain.slotsOf(preferred & ~available));
            }
            if (available == 0L) {
                logger.warn("Teacher {} has no available slot.", id);
            }
            if (teachers.put(id, new Teacher(id, available, preferred)) != null) {
                throw new DataIntegrityException("Teacher " + id + " is defined more than once.");
            }
        }
        return teachers;
    }

    private void addWorkload(int row, WorkloadInput workload, Map<String, Course> courses,
                             Map<String, Teacher> teachers, Map<UnitKey, Unit> units, Set<UnitPair> joints) {
        List<String> courseIds = nonNull(workload.getCourseIds());
        List<String> teacherIds = nonNull(workload.getTeacherIds());
        if (courseIds.isEmpty()) {
            throw new DataIntegrityException("Workload row " + row + " does not name any course.");
        }
        if (teacherIds.isEmpty()) {
            throw new DataIntegrityException("Workload row " + row + " does not name any teacher.");
        }
        String group = normalizeGroup(workload.getOfferingGroup());

        List<Teacher> lecturers = new ArrayList<>();
        for (String rawId : teacherIds) {
            String teacherId = normalizeTeacherId(rawId);
            Teacher teacher = teachers.get(teacherId);
            if (teacher == null) {
                throw new DataIntegrityException("Workload row " + row + " names unknown teacher " + teacherId + ".");
            }
            if (!lecturers.contains(teacher)) {
                lecturers.add(teacher);
            }
        }

        Set<PartOfDay> parts = parseParts(row, workload.getPartsOfDay());
        long fixedMask = workload.getFixedSlots() == null
                ? 0L
                : toMask(workload.getFixedSlots(), "fixed classes of workload row " + row);
        String name = workload.getCourseName() == null ? "" : workload.getCourseName().trim();

        List<UnitKey> rowKeys = new ArrayList<>();
        for (String rawId : courseIds) {
            String courseId = normalizeCourseId(rawId);
            Course course = courses.get(courseId);
            if (course == null) {
                throw new DataIntegrityException("Missing course information for course with id " + courseId + ".");
            }
            UnitKey key = UnitKey.of(courseId, group);
            if (units.containsKey(key)) {
                throw new DataIntegrityException("Unit " + key + " appears in more than one workload row.");
            }
            if (Long.bitCount(fixedMask) > course.getNumClasses()) {
                throw new DataIntegrityException("Unit " + key + " has " + Long.bitCount(fixedMask)
                        + " fixed classes but only " + course.getNumClasses() + " classes per week.");
            }
            units.put(key, new Unit(key, course, lecturers, parts, fixedMask, name));
            rowKeys.add(key);
        }

        for (int i = 0; i < rowKeys.size(); i++) {
            for (int j = i + 1; j < rowKeys.size(); j++) {
                joints.add(UnitPair.of(rowKeys.get(i), rowKeys.get(j)));
            }
        }
    }

    private List<CurriculumMembership> buildCurricula(List<CurriculumInput> inputs, Map<String, Course> courses) {
        List<CurriculumMembership> curricula = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CurriculumInput input : inputs) {
            String courseId = normalizeCourseId(input.getCourseId());
            String curriculumId = requireText(input.getCurriculumId(), "curriculum id").toLowerCase(Locale.ROOT);
            if (!seen.add(curriculumId + "|" + courseId)) {
                throw new DataIntegrityException("Course " + courseId + " is listed twice in curriculum "
                        + curriculumId + ".");
            }
            if (!courses.containsKey(courseId)) {
                logger.debug("Curriculum {} lists course {} which is not offered", curriculumId, courseId);
            }
            curricula.add(new CurriculumMembership(curriculumId, courseId, input.isRequired()));
        }
        return curricula;
    }

    private Set<PartOfDay> parseParts(int row, List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return DEFAULT_PARTS_OF_DAY;
        }
        Set<PartOfDay> parts = EnumSet.noneOf(PartOfDay.class);
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                continue;
            }
            try {
                parts.addAll(PartOfDay.parse(label));
            } catch (IllegalArgumentException e) {
                throw new DataIntegrityException("Workload row " + row + ": " + e.getMessage());
            }
        }
        return parts.isEmpty() ? DEFAULT_PARTS_OF_DAY : parts;
    }

    private long toMask(List<SlotInput> slots, String what) {
        long mask = 0L;
        for (SlotInput slot : slots) {
            try {
                Timeslot timeslot = slotDomain.of(slot.getWeekday(), slot.getPeriod());
                mask |= timeslot.bit();
            } catch (IllegalArgumentException e) {
                throw new DataIntegrityException("Invalid slot in " + what + ": " + e.getMessage());
            }
        }
        return mask;
    }

    static String normalizeCourseId(String courseId) {
        return requireText(courseId, "course id").toLowerCase(Locale.ROOT);
    }

    static String normalizeGroup(String group) {
        if (group == null || group.isBlank()) {
            return DEFAULT_OFFERING_GROUP;
        }
        return group.trim().toLowerCase(Locale.ROOT);
    }

    /** "alan-turing@linux.ime.usp.br" becomes "alan-turing". */
    static String normalizeTeacherId(String teacherId) {
        String id = requireText(teacherId, "teacher id");
        int at = id.indexOf('@');
        if (at > 0) {
            id = id.substring(0, at).trim();
        }
        return id;
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new DataIntegrityException("Empty " + what + ".");
        }
        return value.trim();
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
